package io.agenthub.conflict;

import io.agenthub.config.HubSettings;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps agents to roles and numeric priorities. Lower numbers win. An explicit priority beats the
 * rank of the agent's role; agents with neither get {@link #UNRANKED}.
 */
public final class PriorityModel {
    public static final int UNRANKED = 999;

    private final Map<String, AgentRole> roles = new ConcurrentHashMap<>();
    private final Map<String, Integer> priorities = new ConcurrentHashMap<>();

    public PriorityModel() {
        roles.put("security_validator", AgentRole.SECURITY);
        roles.put("intent_router", AgentRole.ORCHESTRATOR);
        roles.put("audit_agent", AgentRole.COMPLIANCE);
        roles.put("test_agent", AgentRole.QUALITY);
        roles.put("product_architect", AgentRole.DESIGN);
        roles.put("code_engineer", AgentRole.IMPLEMENTATION);
        roles.put("research_agent", AgentRole.INFORMATION);
    }

    public static PriorityModel fromSettings(HubSettings settings) {
        PriorityModel model = new PriorityModel();
        settings.agentRoles().forEach((agent, role) -> model.assignRole(agent, AgentRole.fromString(role)));
        settings.agentPriorities().forEach(model::assignPriority);
        return model;
    }

    public void assignRole(String agentId, AgentRole role) {
        if (role == null) {
            roles.remove(agentId);
        } else {
            roles.put(agentId, role);
        }
    }

    public void assignPriority(String agentId, int priority) {
        priorities.put(agentId, priority);
    }

    public Optional<AgentRole> roleOf(String agentId) {
        return agentId == null ? Optional.empty() : Optional.ofNullable(roles.get(agentId));
    }

    public int priorityOf(String agentId) {
        if (agentId == null) {
            return UNRANKED;
        }
        Integer explicit = priorities.get(agentId);
        if (explicit != null) {
            return explicit;
        }
        AgentRole role = roles.get(agentId);
        return role == null ? UNRANKED : role.rank();
    }
}
