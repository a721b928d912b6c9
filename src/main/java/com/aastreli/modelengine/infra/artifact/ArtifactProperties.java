package com.aastreli.modelengine.infra.artifact;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "model.artifacts")
public class ArtifactProperties {

    private ArtifactStoreType type = ArtifactStoreType.LOCAL;

    private String baseDir;
}
