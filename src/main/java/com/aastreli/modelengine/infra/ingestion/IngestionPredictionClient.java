package com.aastreli.modelengine.infra.ingestion;

import com.aastreli.modelengine.domain.model.ModelBinding;
import com.aastreli.modelengine.infra.ingestion.dto.RemotePredictRequest;
import com.aastreli.modelengine.infra.ingestion.dto.RemotePredictResponse;
import com.aastreli.modelengine.infra.web.InternalKeyFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Ingestion-side caller of {@code POST /predict}. The asset's bound version, when there is one,
 * is sent as {@code modelVersionId}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionPredictionClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient okHttpClient;
    private final IngestionProperties properties;
    private final ModelBindingCache bindingCache;
    private final ObjectMapper objectMapper;

    public Optional<RemotePredictResponse> predict(UUID tenantId, UUID assetId, double[] features, int topK) {
        String modelVersionId = bindingCache.lookup(assetId)
                .map(ModelBinding::modelVersionId)
                .map(UUID::toString)
                .orElse(null);

        try {
            RemotePredictRequest body = new RemotePredictRequest(
                    features,
                    topK,
                    tenantId != null ? tenantId.toString() : null,
                    assetId != null ? assetId.toString() : null,
                    modelVersionId);

            Request.Builder builder = new Request.Builder()
                    .url(properties.getMlService().getBaseUrl() + "/predict")
                    .post(RequestBody.create(objectMapper.writeValueAsBytes(body), JSON));
            String apiKey = properties.getMlService().getApiKey();
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header(InternalKeyFilter.HEADER, apiKey);
            }

            try (Response response = okHttpClient.newCall(builder.build()).execute()) {
                if (!response.isSuccessful()) {
                    log.warn("[Ingestion] 예측 요청 실패: asset={}, version={}, code={}",
                            assetId, modelVersionId, response.code());
                    return Optional.empty();
                }
                ResponseBody responseBody = response.body();
                if (responseBody == null) return Optional.empty();

                RemotePredictResponse result = objectMapper.readValue(responseBody.string(), RemotePredictResponse.class);
                log.debug("[Ingestion] 예측 수신: asset={}, prediction={}, version={}",
                        assetId, result.getPrediction(), result.getModelVersion());
                return Optional.of(result);
            }
        } catch (Exception e) {
            log.error("[Ingestion] 예측 요청 예외: asset={}", assetId, e);
            return Optional.empty();
        }
    }
}
