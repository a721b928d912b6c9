package com.aastreli.modelengine.api;

import com.aastreli.modelengine.domain.model.MlModel;
import com.aastreli.modelengine.domain.model.Tenant;
import com.aastreli.modelengine.domain.repository.MlModelRepository;
import com.aastreli.modelengine.domain.repository.TenantRepository;
import com.aastreli.modelengine.support.ModelFixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ModelEngineApiTest {

    @TempDir
    static Path modelDir;

    @DynamicPropertySource
    static void modelDirectories(DynamicPropertyRegistry registry) {
        ModelFixtures.writeBundle(modelDir.resolve("current"), ModelFixtures.bundle("v1"), new ObjectMapper());
        registry.add("model.registry.model-dir", modelDir::toString);
        registry.add("model.registry.current-model-dir", () -> modelDir.resolve("current").toString());
        registry.add("model.artifacts.base-dir", modelDir::toString);
    }

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    TenantRepository tenantRepository;

    @Autowired
    MlModelRepository modelRepository;

    @Test
    void healthReportsLoadedFallbackModel() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.modelVersion").value("v1"))
                .andExpect(jsonPath("$.details.modelLoaded").value(true));

        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.modelRegistry.status").value("UP"));
    }

    @Test
    void predictUsesFallbackModel() throws Exception {
        mockMvc.perform(post("/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"features\":[5.1,4.9,5.0],\"topK\":2,\"requestId\":\"req-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prediction").value("bearing_fault"))
                .andExpect(jsonPath("$.topPredictions.length()").value(2))
                .andExpect(jsonPath("$.modelVersion").value("v1"))
                .andExpect(jsonPath("$.modelVersionId").isEmpty())
                .andExpect(jsonPath("$.requestId").value("req-1"));
    }

    @Test
    void predictAcceptsSnakeCaseFields() throws Exception {
        mockMvc.perform(post("/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"features\":[0.1,-0.1,0.05],\"top_k\":1,\"model_version_id\":\"not-a-uuid\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prediction").value("normal"))
                .andExpect(jsonPath("$.topPredictions.length()").value(1));
    }

    @Test
    void invalidPredictRequestsAreRejected() throws Exception {
        mockMvc.perform(post("/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"features\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("validation_failed"))
                .andExpect(jsonPath("$.fields.features").exists());

        mockMvc.perform(post("/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"features\":[1,2,3],\"topK\":11}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"features\":[1,2]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("bad_request"));

        mockMvc.perform(post("/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"features\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("malformed_json"));
    }

    @Test
    void batchPredictValidatesEveryItem() throws Exception {
        mockMvc.perform(post("/predict-batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"features\":[0.1,-0.1,0.05]},{\"features\":[5.1,4.9,5.0],\"requestId\":\"b\"}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].prediction").value("normal"))
                .andExpect(jsonPath("$[1].prediction").value("bearing_fault"))
                .andExpect(jsonPath("$[1].requestId").value("b"));

        mockMvc.perform(post("/predict-batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"features\":[0.1,-0.1,0.05]},{\"features\":[]}]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("validation_failed"));
    }

    @Test
    void unknownVersionsAreNotFound() throws Exception {
        mockMvc.perform(get("/models/v404"))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/models/v404/activate"))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/models/versions/" + UUID.randomUUID() + "/deploy"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("model_version_not_found"));
    }

    @Test
    void retrainRejectsMalformedTenantId() throws Exception {
        mockMvc.perform(post("/retrain")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tenantId\":\"plant-a\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void metricsDescribeCurrentModel() throws Exception {
        mockMvc.perform(get("/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.numClasses").value(2))
                .andExpect(jsonPath("$.metrics.accuracy").value(1.0));
    }

    @Test
    void feedbackRetrainDeployPredictLifecycle() throws Exception {
        UUID tenantId = tenantRepository.save(Tenant.builder()
                .tenantCode("default").tenantName("Default").build()).getId();
        modelRepository.save(MlModel.builder()
                .tenantId(tenantId).modelName("fault_classifier").modelType("gaussian_nb").build());

        double[][] gear = ModelFixtures.cluster(new double[]{-5, 5, -5}, "gear_wear", 3, 5L).features();
        JsonNode last = null;
        for (double[] row : gear) {
            String body = objectMapper.writeValueAsString(Map.of(
                    "features", row,
                    "original_prediction", "normal",
                    "corrected_label", "gear_wear",
                    "feedback_type", "new_fault",
                    "confidence", 0.55));
            String response = mockMvc.perform(post("/feedback")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isOk())
                    .andReturn().getResponse().getContentAsString();
            last = objectMapper.readTree(response);
        }
        assertThat(last.get("totalFeedback").asLong()).isEqualTo(3);
        assertThat(last.get("readyForRetraining").asBoolean()).isTrue();

        mockMvc.perform(get("/feedback/stats").param("tenantId", tenantId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.newFaults").value(3));

        String retrained = mockMvc.perform(post("/retrain")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"asyncMode\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andReturn().getResponse().getContentAsString();
        String versionId = objectMapper.readTree(retrained).get("newVersionId").asText();

        mockMvc.perform(post("/models/versions/" + versionId + "/deploy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"isProduction\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isProduction").value(true));

        mockMvc.perform(post("/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"features\":[-5.0,5.0,-5.0],\"tenantId\":\"" + tenantId + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prediction").value("gear_wear"))
                .andExpect(jsonPath("$.modelVersionId").value(versionId));

        mockMvc.perform(post("/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"features\":[-5.0,5.0,-5.0]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.modelVersionId").isEmpty());
    }
}
