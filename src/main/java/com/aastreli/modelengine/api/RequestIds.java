package com.aastreli.modelengine.api;

import java.util.UUID;

final class RequestIds {

    private RequestIds() {
    }

    /**
     * Lenient UUID parsing for optional request fields; malformed values read as absent.
     */
    static UUID parseOrNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
