package io.agenthub.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageType {
    REQUEST,
    RESPONSE,
    EVENT,
    COORDINATION,
    ESCALATION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MessageType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("message type must not be blank");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
