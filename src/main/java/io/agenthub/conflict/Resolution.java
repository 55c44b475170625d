package io.agenthub.conflict;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of running a {@link ConflictStrategy} against an existing value.
 */
public record Resolution(boolean accepted, JsonNode value, String reason) {
    public static Resolution accept(JsonNode value) {
        return new Resolution(true, value, null);
    }

    public static Resolution reject(String reason) {
        return new Resolution(false, null, reason);
    }
}
