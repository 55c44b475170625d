package io.agenthub.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import io.agenthub.util.Jsons;

import java.util.Locale;
import java.util.Map;

public record Response(
        String requestId,
        String agentId,
        Status status,
        JsonNode result,
        Map<String, Object> metadata,
        long executionTimeMs
) {
    public static final String COORDINATED = "coordinated";

    public Response {
        result = result == null ? Jsons.object() : result;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public enum Status {
        SUCCESS,
        PARTIAL,
        ERROR;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Status fromString(String raw) {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        }
    }
}
