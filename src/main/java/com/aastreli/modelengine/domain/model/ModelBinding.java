package com.aastreli.modelengine.domain.model;

import java.util.UUID;

public record ModelBinding(
        UUID assetId,
        UUID modelId,
        UUID modelVersionId,
        String versionLabel,
        String artifactPath
) {
    public ModelBinding {
        versionLabel = versionLabel == null ? "" : versionLabel;
    }
}
