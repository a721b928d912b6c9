package com.aastreli.modelengine.domain.service.registry;

import java.util.UUID;

public record LoadedModel(ModelHandle handle, UUID versionId, String versionLabel) {

    public boolean isFallback() {
        return versionId == null;
    }
}
