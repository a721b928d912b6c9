package com.aastreli.modelengine.infra.ingestion.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RemotePredictRequest(
        double[] features,
        int topK,
        String tenantId,
        String assetId,
        String modelVersionId
) {
}
