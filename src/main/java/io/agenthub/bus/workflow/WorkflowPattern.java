package io.agenthub.bus.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum WorkflowPattern {
    SEQUENTIAL,
    PARALLEL,
    ITERATIVE,
    ESCALATION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WorkflowPattern fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("workflow pattern is required");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
