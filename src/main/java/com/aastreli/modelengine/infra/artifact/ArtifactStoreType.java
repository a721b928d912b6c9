package com.aastreli.modelengine.infra.artifact;

public enum ArtifactStoreType {
    LOCAL,
    REMOTE,
    DATABASE
}
