package io.agenthub.conflict;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Agents disagreeing about one decision. {@code proposals} maps each agent to the outcome it wants.
 */
public record AgentConflict(
        String id,
        List<String> conflictingAgents,
        String conflictType,
        String description,
        Map<String, JsonNode> proposals
) {
    public static final String SECURITY_CONFLICT = "security_conflict";

    public AgentConflict {
        conflictingAgents = conflictingAgents == null ? List.of() : List.copyOf(conflictingAgents);
        proposals = proposals == null ? Map.of() : new LinkedHashMap<>(proposals);
    }

    public static AgentConflict of(List<String> agents, String conflictType, String description, Map<String, JsonNode> proposals) {
        return new AgentConflict(UUID.randomUUID().toString(), agents, conflictType, description, proposals);
    }
}
