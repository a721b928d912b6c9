package com.aastreli.modelengine.domain.service.retraining;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "model.retraining")
public class RetrainingProperties {

    private int minFeedback = 10;

    private boolean includeOriginalData = true;

    private int feedbackWeightMultiplier = 3;

    private double validationFraction = 0.2;

    private long randomSeed = 42L;

    private int workerThreads = 2;

    private int queueCapacity = 8;

    private String normalLabel = "normal";
}
