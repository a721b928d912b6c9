package com.aastreli.modelengine.domain.service.registry;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "model.registry")
public class ModelRegistryProperties {

    private String modelDir = "./models";

    private String currentModelDir = "./models/current";

    private int maxLoadedModels = 10;

    private long refreshIntervalSeconds = 60;

    private String defaultModelName = "fault_classifier";
}
