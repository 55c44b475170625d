package io.agenthub.conflict;

import java.util.Locale;

/**
 * Fixed role hierarchy used to break ties between agents. Lower rank wins.
 */
public enum AgentRole {
    SECURITY(1),
    ORCHESTRATOR(2),
    COMPLIANCE(3),
    QUALITY(4),
    DESIGN(5),
    IMPLEMENTATION(6),
    INFORMATION(7);

    private final int rank;

    AgentRole(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static AgentRole fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("role must not be blank");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("QUALITY_ASSURANCE".equals(normalized) || "QA".equals(normalized)) {
            return QUALITY;
        }
        return valueOf(normalized);
    }
}
