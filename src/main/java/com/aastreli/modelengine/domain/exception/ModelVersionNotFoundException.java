package com.aastreli.modelengine.domain.exception;

public class ModelVersionNotFoundException extends RuntimeException {

    public ModelVersionNotFoundException(String version) {
        super("Model version not found: " + version);
    }
}
