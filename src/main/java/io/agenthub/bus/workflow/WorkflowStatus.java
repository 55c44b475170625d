package io.agenthub.bus.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum WorkflowStatus {
    ACTIVE,
    COMPLETED,
    FAILED,
    ESCALATED,
    EXPIRED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WorkflowStatus fromString(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
