package com.aastreli.modelengine.domain.service.retraining;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RetrainStatus {
    COMPLETED("completed"),
    STARTED("started"),
    INSUFFICIENT_FEEDBACK("insufficient_feedback"),
    NO_FEEDBACK("no_feedback"),
    ALREADY_RUNNING("already_running"),
    REJECTED("rejected"),
    FAILED("failed");

    private final String code;

    RetrainStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
