package io.agenthub.agent;

public record RegistrationOutcome(boolean registered, String agentId, String reason) {
    static RegistrationOutcome ok(String agentId) {
        return new RegistrationOutcome(true, agentId, null);
    }

    static RegistrationOutcome error(String agentId, String reason) {
        return new RegistrationOutcome(false, agentId, reason);
    }
}
