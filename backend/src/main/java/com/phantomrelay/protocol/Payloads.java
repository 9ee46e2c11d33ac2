package com.phantomrelay.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Presence checks for inbound fields. A value counts as missing when it is
 * absent, JSON {@code null} or an empty string. Nothing else about a payload
 * is inspected: {@code false}, {@code 0} and empty objects are opaque values
 * and count as present.
 */
public final class Payloads {

    private Payloads() {
    }

    public static boolean isMissing(String value) {
        return value == null || value.isEmpty();
    }

    public static boolean isMissing(JsonNode value) {
        return value == null
                || value.isNull()
                || value.isMissingNode()
                || (value.isTextual() && value.asText().isEmpty());
    }
}
