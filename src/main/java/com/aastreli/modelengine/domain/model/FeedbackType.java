package com.aastreli.modelengine.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.AttributeConverter;

import java.util.Locale;

public enum FeedbackType {
    CORRECT("correct"),
    CORRECTION("correction"),
    NEW_FAULT("new_fault"),
    FALSE_POSITIVE("false_positive");

    private final String code;

    FeedbackType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static FeedbackType fromCode(String code) {
        if (code == null) return null;
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (FeedbackType type : values()) {
            if (type.code.equals(normalized)) return type;
        }
        throw new IllegalArgumentException("Unknown feedback type: " + code);
    }

    @jakarta.persistence.Converter
    public static class Converter implements AttributeConverter<FeedbackType, String> {

        @Override
        public String convertToDatabaseColumn(FeedbackType attribute) {
            return attribute == null ? null : attribute.code;
        }

        @Override
        public FeedbackType convertToEntityAttribute(String dbData) {
            return fromCode(dbData);
        }
    }
}
