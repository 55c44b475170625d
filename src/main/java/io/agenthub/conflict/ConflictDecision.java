package io.agenthub.conflict;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record ConflictDecision(
        String conflictId,
        String winner,
        Basis basis,
        JsonNode chosenResolution,
        String reasoning,
        List<String> affectedAgents,
        String escalationId
) {
    public static final String HUMAN_OVERSIGHT = "human_oversight";

    public enum Basis {
        SECURITY_OVERRIDE,
        ROLE_PRIORITY,
        HUMAN_OVERSIGHT
    }

    public boolean escalated() {
        return escalationId != null;
    }
}
