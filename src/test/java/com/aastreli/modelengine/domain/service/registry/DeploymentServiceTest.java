package com.aastreli.modelengine.domain.service.registry;

import com.aastreli.modelengine.domain.exception.ModelVersionNotFoundException;
import com.aastreli.modelengine.domain.model.MlModel;
import com.aastreli.modelengine.domain.model.ModelDeployment;
import com.aastreli.modelengine.domain.model.ModelStage;
import com.aastreli.modelengine.domain.model.ModelVersion;
import com.aastreli.modelengine.domain.model.Tenant;
import com.aastreli.modelengine.domain.repository.MlModelRepository;
import com.aastreli.modelengine.domain.repository.ModelDeploymentRepository;
import com.aastreli.modelengine.domain.repository.ModelVersionRepository;
import com.aastreli.modelengine.domain.repository.TenantRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(DeploymentService.class)
class DeploymentServiceTest {

    @Autowired
    DeploymentService deploymentService;

    @Autowired
    TenantRepository tenantRepository;

    @Autowired
    MlModelRepository modelRepository;

    @Autowired
    ModelVersionRepository versionRepository;

    @Autowired
    ModelDeploymentRepository deploymentRepository;

    private UUID tenantId;
    private UUID modelId;

    @BeforeEach
    void setUp() {
        tenantId = tenantRepository.save(Tenant.builder()
                .tenantCode("plant-a")
                .tenantName("Plant A")
                .build()).getId();
        modelId = modelRepository.save(MlModel.builder()
                .tenantId(tenantId)
                .modelName("fault_classifier")
                .modelType("gaussian_nb")
                .build()).getId();
    }

    private ModelVersion version(int n) {
        return versionRepository.save(ModelVersion.builder()
                .tenantId(tenantId)
                .modelId(modelId)
                .semanticVersion("1.0." + n)
                .fullVersionLabel("fault_classifier:1.0." + n)
                .artifactPath("versions/v" + n)
                .build());
    }

    @Test
    void productionDeployPromotesVersion() {
        ModelVersion v1 = version(1);

        DeploymentResult result = deploymentService.deploy(v1.getId(), true);

        assertThat(result.production()).isTrue();
        assertThat(result.tenantId()).isEqualTo(tenantId);
        assertThat(result.versionLabel()).isEqualTo("fault_classifier:1.0.1");
        assertThat(result.artifactPath()).isEqualTo("versions/v1");
        assertThat(result.rollbackFromVersionId()).isNull();
        assertThat(versionRepository.findById(v1.getId())).get()
                .extracting(ModelVersion::getStage).isEqualTo(ModelStage.PRODUCTION);
    }

    @Test
    void secondProductionDeployClosesPreviousAndArchivesIt() {
        ModelVersion v1 = version(1);
        ModelVersion v2 = version(2);

        deploymentService.deploy(v1.getId(), true);
        DeploymentResult second = deploymentService.deploy(v2.getId(), true);

        List<ModelDeployment> open = deploymentRepository
                .findByTenantIdAndModelIdAndProductionTrueAndDeploymentEndIsNull(tenantId, modelId);
        assertThat(open).singleElement()
                .extracting(ModelDeployment::getModelVersionId).isEqualTo(v2.getId());
        assertThat(second.rollbackFromVersionId()).isEqualTo(v1.getId());
        assertThat(versionRepository.findById(v1.getId())).get()
                .extracting(ModelVersion::getStage).isEqualTo(ModelStage.ARCHIVED);
        assertThat(deploymentRepository.findAll())
                .filteredOn(d -> d.getModelVersionId().equals(v1.getId()))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.isOpen()).isFalse();
                    assertThat(d.isProduction()).isFalse();
                });
    }

    @Test
    void redeployingSameVersionHasNoRollbackSource() {
        ModelVersion v1 = version(1);

        deploymentService.deploy(v1.getId(), true);
        DeploymentResult again = deploymentService.deploy(v1.getId(), true);

        assertThat(again.rollbackFromVersionId()).isNull();
        assertThat(deploymentRepository
                .countByTenantIdAndModelIdAndProductionTrueAndDeploymentEndIsNull(tenantId, modelId))
                .isEqualTo(1);
        assertThat(versionRepository.findById(v1.getId())).get()
                .extracting(ModelVersion::getStage).isEqualTo(ModelStage.PRODUCTION);
    }

    @Test
    void nonProductionDeployLeavesOpenProductionUntouched() {
        ModelVersion v1 = version(1);
        ModelVersion v2 = version(2);
        deploymentService.deploy(v1.getId(), true);

        DeploymentResult shadow = deploymentService.deploy(v2.getId(), false);

        assertThat(shadow.production()).isFalse();
        assertThat(deploymentRepository
                .findByTenantIdAndModelIdAndProductionTrueAndDeploymentEndIsNull(tenantId, modelId))
                .singleElement()
                .extracting(ModelDeployment::getModelVersionId).isEqualTo(v1.getId());
        assertThat(versionRepository.findById(v2.getId())).get()
                .extracting(ModelVersion::getStage).isEqualTo(ModelStage.STAGING);
    }

    @Test
    void unknownOrDeletedVersionIsNotFound() {
        ModelVersion deleted = version(3);
        deleted.setDeleted(true);
        versionRepository.saveAndFlush(deleted);

        assertThatThrownBy(() -> deploymentService.deploy(UUID.randomUUID(), true))
                .isInstanceOf(ModelVersionNotFoundException.class);
        assertThatThrownBy(() -> deploymentService.deploy(deleted.getId(), true))
                .isInstanceOf(ModelVersionNotFoundException.class);
        assertThat(deploymentRepository.count()).isZero();
    }
}
