package io.agenthub.agent;

import io.agenthub.bus.MessageBus;
import io.agenthub.bus.MessageHandler;
import io.agenthub.observability.AuditLogger;
import io.agenthub.observability.HubMetrics;
import io.agenthub.storage.DurableStore;
import io.agenthub.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Agents known to the hub, keyed by id. Registration also wires the agent's handler into the bus,
 * so an agent is routable exactly while it is registered.
 */
public final class AgentRegistry {
    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);
    public static final String STORE_PREFIX = "agent:";

    private final Map<String, AgentDescriptor> agents = new ConcurrentHashMap<>();
    private final Map<String, Counters> counters = new ConcurrentHashMap<>();
    private final MessageBus bus;
    private final DurableStore store;
    private final AuditLogger audit;
    private final HubMetrics metrics;
    private final LongSupplier clock;
    private final long heartbeatTimeoutMs;

    public AgentRegistry(MessageBus bus, DurableStore store, AuditLogger audit, HubMetrics metrics,
                         long heartbeatTimeoutMs, LongSupplier clock) {
        this.bus = bus;
        this.store = store;
        this.audit = audit;
        this.metrics = metrics;
        this.heartbeatTimeoutMs = heartbeatTimeoutMs;
        this.clock = clock;
    }

    public RegistrationOutcome register(AgentDescriptor descriptor, MessageHandler handler) {
        if (descriptor == null || descriptor.agentId() == null || descriptor.agentId().isBlank()) {
            return RegistrationOutcome.error(null, "agent id is required");
        }
        String agentId = descriptor.agentId();
        if (handler == null) {
            return RegistrationOutcome.error(agentId, "handler is required");
        }
        if (descriptor.currentLoad() < 0.0d || descriptor.currentLoad() > 1.0d) {
            return RegistrationOutcome.error(agentId, "load must be between 0 and 1");
        }
        AgentDescriptor stamped = descriptor.withHeartbeat(descriptor.status(), descriptor.currentLoad(), clock.getAsLong());
        agents.put(agentId, stamped);
        counters.putIfAbsent(agentId, new Counters());
        bus.registerHandler(agentId, handler);
        persist(stamped);
        metrics.setGauge(HubMetrics.AGENT_LOAD, agentId, stamped.currentLoad());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", stamped.agentType() == null ? "" : stamped.agentType());
        details.put("capabilities", stamped.capabilities());
        audit.log(AuditLogger.AuditEvent.of("agent.register", agentId, STORE_PREFIX + agentId, "ok", details));
        log.info("agent registered id={} type={} capabilities={}", agentId, stamped.agentType(), stamped.capabilities());
        return RegistrationOutcome.ok(agentId);
    }

    public boolean deregister(String agentId) {
        AgentDescriptor removed = agentId == null ? null : agents.remove(agentId);
        if (removed == null) {
            return false;
        }
        counters.remove(agentId);
        bus.unregisterHandler(agentId);
        store.delete(STORE_PREFIX + agentId);
        metrics.removeGauge(HubMetrics.AGENT_LOAD, agentId);
        audit.log(AuditLogger.AuditEvent.of("agent.deregister", agentId, STORE_PREFIX + agentId, "ok", Map.of()));
        log.info("agent deregistered id={}", agentId);
        return true;
    }

    public boolean heartbeat(String agentId, AgentStatus status, double load) {
        double clamped = Math.max(0.0d, Math.min(1.0d, load));
        AgentDescriptor updated = agents.computeIfPresent(agentId,
                (id, current) -> current.withHeartbeat(status == null ? current.status() : status, clamped, clock.getAsLong()));
        if (updated == null) {
            log.warn("heartbeat from unregistered agent {}", agentId);
            return false;
        }
        metrics.setGauge(HubMetrics.AGENT_LOAD, agentId, clamped);
        persist(updated);
        return true;
    }

    public boolean updateCapabilities(String agentId, List<String> capabilities) {
        AgentDescriptor updated = agents.computeIfPresent(agentId, (id, current) -> current.withCapabilities(capabilities));
        if (updated == null) {
            log.warn("attempted to update capabilities for unregistered agent {}", agentId);
            return false;
        }
        persist(updated);
        log.info("agent capabilities updated id={} count={}", agentId, updated.capabilities().size());
        return true;
    }

    public Optional<AgentDescriptor> find(String agentId) {
        return agentId == null ? Optional.empty() : Optional.ofNullable(agents.get(agentId));
    }

    public List<AgentDescriptor> list() {
        List<AgentDescriptor> out = new ArrayList<>(agents.values());
        out.sort(Comparator.comparing(AgentDescriptor::agentId));
        return out;
    }

    /** Idle agents below {@code loadThreshold} that carry {@code bucket}, ordered by id. */
    public List<String> available(String bucket, double loadThreshold) {
        List<String> out = new ArrayList<>();
        for (AgentDescriptor descriptor : list()) {
            if (descriptor.hasCapability(bucket) && descriptor.isAvailable(loadThreshold)) {
                out.add(descriptor.agentId());
            }
        }
        return out;
    }

    public void recordResult(String agentId, boolean success, long elapsedMs) {
        Counters c = counters.get(agentId);
        if (c == null) {
            return;
        }
        c.requests.incrementAndGet();
        if (success) {
            c.successes.incrementAndGet();
        }
        c.totalElapsedMs.addAndGet(Math.max(0L, elapsedMs));
    }

    public List<AgentPerformance> performance() {
        List<AgentPerformance> out = new ArrayList<>();
        for (AgentDescriptor descriptor : list()) {
            Counters c = counters.getOrDefault(descriptor.agentId(), new Counters());
            long requests = c.requests.get();
            long successes = c.successes.get();
            out.add(new AgentPerformance(
                    descriptor.agentId(),
                    descriptor.agentType(),
                    requests,
                    successes,
                    requests == 0 ? 0.0d : (double) c.totalElapsedMs.get() / requests,
                    requests == 0 ? 1.0d : (double) successes / requests,
                    descriptor.currentLoad(),
                    descriptor.lastHeartbeatMs()
            ));
        }
        return out;
    }

    public List<String> sweepHeartbeats() {
        return sweepHeartbeats(clock.getAsLong());
    }

    /**
     * Marks agents silent for longer than the heartbeat timeout as {@link AgentStatus#ERROR}.
     *
     * @return ids flipped by this sweep
     */
    public List<String> sweepHeartbeats(long nowMs) {
        List<String> flipped = new ArrayList<>();
        for (AgentDescriptor descriptor : list()) {
            if (descriptor.status() == AgentStatus.ERROR || nowMs - descriptor.lastHeartbeatMs() <= heartbeatTimeoutMs) {
                continue;
            }
            AgentDescriptor errored = descriptor.withStatus(AgentStatus.ERROR);
            if (agents.replace(descriptor.agentId(), descriptor, errored)) {
                persist(errored);
                flipped.add(descriptor.agentId());
                log.warn("agent heartbeat timeout id={} lastHeartbeatMs={}", descriptor.agentId(), descriptor.lastHeartbeatMs());
            }
        }
        return flipped;
    }

    private void persist(AgentDescriptor descriptor) {
        store.put(STORE_PREFIX + descriptor.agentId(), Jsons.toJson(descriptor), 0L);
    }

    private static final class Counters {
        private final AtomicLong requests = new AtomicLong();
        private final AtomicLong successes = new AtomicLong();
        private final AtomicLong totalElapsedMs = new AtomicLong();
    }
}
