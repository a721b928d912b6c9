package com.aastreli.modelengine.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.AttributeConverter;

import java.util.Locale;

public enum ModelStage {
    STAGING("staging"),
    PRODUCTION("production"),
    ARCHIVED("archived");

    private final String code;

    ModelStage(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ModelStage fromCode(String code) {
        if (code == null) return null;
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (ModelStage stage : values()) {
            if (stage.code.equals(normalized)) return stage;
        }
        throw new IllegalArgumentException("Unknown model stage: " + code);
    }

    /**
     * Stage column stores the lowercase code used by the shared schema.
     */
    @jakarta.persistence.Converter
    public static class Converter implements AttributeConverter<ModelStage, String> {

        @Override
        public String convertToDatabaseColumn(ModelStage attribute) {
            return attribute == null ? null : attribute.code;
        }

        @Override
        public ModelStage convertToEntityAttribute(String dbData) {
            return fromCode(dbData);
        }
    }
}
