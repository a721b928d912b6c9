package com.aastreli.modelengine.infra.artifact;

import com.aastreli.modelengine.domain.service.registry.ModelRegistryProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.nio.file.Path;

@Slf4j
@Configuration
public class ArtifactStoreConfig {

    @Bean
    public ArtifactStore artifactStore(ArtifactProperties properties,
                                       ModelRegistryProperties registryProperties,
                                       ObjectMapper objectMapper) {
        String baseDir = StringUtils.hasText(properties.getBaseDir())
                ? properties.getBaseDir()
                : registryProperties.getModelDir();

        return switch (properties.getType()) {
            case LOCAL -> {
                log.info("[Artifacts] 로컬 아티팩트 저장소 사용: baseDir={}", baseDir);
                yield new LocalArtifactStore(Path.of(baseDir), objectMapper);
            }
            case REMOTE, DATABASE -> throw new IllegalStateException(
                    "Artifact store type not supported: " + properties.getType());
        };
    }
}
