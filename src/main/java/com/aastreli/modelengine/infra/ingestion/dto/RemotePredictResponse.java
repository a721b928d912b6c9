package com.aastreli.modelengine.infra.ingestion.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RemotePredictResponse {

    private String prediction;
    private double confidence;
    private List<Score> topPredictions;
    private String modelVersion;
    private String modelVersionId;
    private String timestamp;

    @Getter
    @Setter
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Score {
        private String label;
        private double confidence;
    }
}
