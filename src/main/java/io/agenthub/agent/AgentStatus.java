package io.agenthub.agent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AgentStatus {
    IDLE,
    BUSY,
    ERROR,
    MAINTENANCE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AgentStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return IDLE;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
