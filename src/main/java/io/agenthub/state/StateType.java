package io.agenthub.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StateType {
    CONFIGURATION,
    WORKFLOW_STATE,
    AGENT_STATE,
    USER_PREFERENCES,
    DECISION_HISTORY,
    RISK_ASSESSMENT,
    PERFORMANCE_METRICS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StateType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return CONFIGURATION;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
