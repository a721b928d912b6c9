package com.aastreli.modelengine.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record PredictRequest(
        @NotEmpty List<@NotNull Double> features,
        @JsonAlias("top_k") @Min(1) @Max(10) Integer topK,
        @JsonAlias("tenant_id") String tenantId,
        @JsonAlias("asset_id") String assetId,
        @JsonAlias("model_version_id") String modelVersionId,
        @JsonAlias("request_id") String requestId
) {

    public static final int DEFAULT_TOP_K = 3;

    public int topKOrDefault() {
        return topK != null ? topK : DEFAULT_TOP_K;
    }

    public double[] featureArray() {
        return features.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
