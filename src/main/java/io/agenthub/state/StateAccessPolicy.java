package io.agenthub.state;

import io.agenthub.conflict.AgentRole;
import io.agenthub.conflict.PriorityModel;

/**
 * Read and write rules for each {@link AccessLevel}.
 * <p>
 * Restricted risk assessments belong to security agents only. Restricted configuration is open to
 * agents ranked {@value #RESTRICTED_CONFIGURATION_MAX_PRIORITY} or better. Every other restricted
 * state type is closed to all agents.
 */
public final class StateAccessPolicy {
    static final int PROTECTED_WRITE_MAX_PRIORITY = 3;
    static final int RESTRICTED_CONFIGURATION_MAX_PRIORITY = 2;

    private final PriorityModel priorities;

    public StateAccessPolicy(PriorityModel priorities) {
        this.priorities = priorities;
    }

    public boolean canRead(String agentId, StateEntry entry) {
        return switch (entry.accessLevel()) {
            case PUBLIC, PROTECTED -> true;
            case PRIVATE -> isOwner(agentId, entry);
            case RESTRICTED -> restricted(agentId, entry);
        };
    }

    public boolean canWrite(String agentId, StateEntry entry) {
        return switch (entry.accessLevel()) {
            case PUBLIC -> true;
            case PROTECTED -> isOwner(agentId, entry)
                    || priorities.priorityOf(agentId) <= PROTECTED_WRITE_MAX_PRIORITY;
            case PRIVATE -> isOwner(agentId, entry);
            case RESTRICTED -> restricted(agentId, entry);
        };
    }

    private boolean restricted(String agentId, StateEntry entry) {
        if (entry.stateType() == StateType.RISK_ASSESSMENT) {
            return priorities.roleOf(agentId).filter(role -> role == AgentRole.SECURITY).isPresent();
        }
        if (entry.stateType() == StateType.CONFIGURATION) {
            return priorities.priorityOf(agentId) <= RESTRICTED_CONFIGURATION_MAX_PRIORITY;
        }
        return false;
    }

    private static boolean isOwner(String agentId, StateEntry entry) {
        return agentId != null && agentId.equals(entry.ownerAgent());
    }
}
