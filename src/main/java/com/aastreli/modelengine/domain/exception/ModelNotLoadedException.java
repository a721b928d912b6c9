package com.aastreli.modelengine.domain.exception;

public class ModelNotLoadedException extends RuntimeException {

    public ModelNotLoadedException() {
        super("Model not loaded");
    }
}
