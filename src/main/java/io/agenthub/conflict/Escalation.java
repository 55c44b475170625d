package io.agenthub.conflict;

import java.util.List;
import java.util.Map;

public record Escalation(
        String id,
        EscalationKind kind,
        String resource,
        List<String> agents,
        String reason,
        Map<String, Object> details,
        long createdAtMs,
        Status status,
        String resolution
) {
    public enum Status {
        OPEN,
        RESOLVED
    }

    public Escalation {
        agents = agents == null ? List.of() : List.copyOf(agents);
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    Escalation resolved(String how) {
        return new Escalation(id, kind, resource, agents, reason, details, createdAtMs, Status.RESOLVED, how);
    }
}
