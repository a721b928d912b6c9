package com.aastreli.modelengine.domain.exception;

public class ArtifactNotFoundException extends RuntimeException {

    public ArtifactNotFoundException(String version) {
        super("Model artifacts not found: " + version);
    }
}
