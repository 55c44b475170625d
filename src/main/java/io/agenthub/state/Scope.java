package io.agenthub.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Scope {
    GLOBAL,
    WORKFLOW,
    AGENT,
    USER,
    TEMPORARY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Scope fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return GLOBAL;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
