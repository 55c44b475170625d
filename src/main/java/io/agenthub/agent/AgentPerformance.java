package io.agenthub.agent;

public record AgentPerformance(
        String agentId,
        String agentType,
        long requestsProcessed,
        long successes,
        double averageResponseMs,
        double successRate,
        double currentLoad,
        long lastHeartbeatMs
) {
}
