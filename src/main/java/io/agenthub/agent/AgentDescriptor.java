package io.agenthub.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Registry view of one agent. Capabilities are the bucket names the router matches against
 * (for example {@code defi}, {@code security}).
 */
public record AgentDescriptor(
        String agentId,
        String agentType,
        List<String> capabilities,
        AgentStatus status,
        double currentLoad,
        int maxConcurrentTasks,
        long lastHeartbeatMs
) {
    public AgentDescriptor {
        capabilities = normalize(capabilities);
        status = status == null ? AgentStatus.IDLE : status;
        maxConcurrentTasks = Math.max(1, maxConcurrentTasks);
    }

    public static AgentDescriptor idle(String agentId, String agentType, List<String> capabilities) {
        return new AgentDescriptor(agentId, agentType, capabilities, AgentStatus.IDLE, 0.0d, 1, 0L);
    }

    public boolean hasCapability(String bucket) {
        return bucket != null && capabilities.contains(bucket.toLowerCase(Locale.ROOT));
    }

    public boolean isAvailable(double loadThreshold) {
        return status == AgentStatus.IDLE && currentLoad < loadThreshold;
    }

    public AgentDescriptor withStatus(AgentStatus next) {
        return new AgentDescriptor(agentId, agentType, capabilities, next, currentLoad, maxConcurrentTasks, lastHeartbeatMs);
    }

    public AgentDescriptor withHeartbeat(AgentStatus next, double load, long nowMs) {
        return new AgentDescriptor(agentId, agentType, capabilities, next, load, maxConcurrentTasks, nowMs);
    }

    public AgentDescriptor withCapabilities(List<String> next) {
        return new AgentDescriptor(agentId, agentType, next, status, currentLoad, maxConcurrentTasks, lastHeartbeatMs);
    }

    private static List<String> normalize(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String value : raw) {
            if (value != null && !value.isBlank()) {
                String cleaned = value.trim().toLowerCase(Locale.ROOT);
                if (!out.contains(cleaned)) {
                    out.add(cleaned);
                }
            }
        }
        return List.copyOf(out);
    }
}
