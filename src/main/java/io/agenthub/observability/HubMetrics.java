package io.agenthub.observability;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process counters and labelled gauges shared by every component of one hub.
 */
public final class HubMetrics {
    public static final String MESSAGES_SENT = "messages_sent";
    public static final String MESSAGES_DELIVERED = "messages_delivered";
    public static final String MESSAGES_RETRIED = "messages_retried";
    public static final String MESSAGES_REJECTED = "messages_rejected";
    public static final String MESSAGES_DEAD_LETTERED = "messages_dead_lettered";
    public static final String BROADCASTS = "broadcasts";
    public static final String COORDINATIONS = "coordinations";
    public static final String CONSENSUS_FAILURES = "consensus_failures";
    public static final String ROUTING_FAILURES = "routing_failures";
    public static final String CONFLICTS_RESOLVED = "conflicts_resolved";
    public static final String ESCALATIONS = "escalations";
    public static final String LOCKS_GRANTED = "locks_granted";
    public static final String LOCKS_DENIED = "locks_denied";
    public static final String LOCKS_RECLAIMED = "locks_reclaimed";
    public static final String TRANSACTIONS_COMMITTED = "transactions_committed";
    public static final String TRANSACTIONS_ABORTED = "transactions_aborted";
    public static final String STATE_WRITES = "state_writes";
    public static final String STATE_WRITES_REJECTED = "state_writes_rejected";
    public static final String CACHE_REPAIRS = "cache_repairs";
    public static final String CACHE_EVICTIONS = "cache_evictions";
    public static final String WORKFLOWS_STARTED = "workflows_started";
    public static final String WORKFLOWS_STUCK = "workflows_stuck";
    public static final String LOW_STARVATION = "low_starvation";

    public static final String AGENT_LOAD = "agent_load";
    public static final String QUEUE_DEPTH = "queue_depth";

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Double>> gauges = new ConcurrentHashMap<>();

    public void increment(String counter) {
        add(counter, 1L);
    }

    public void add(String counter, long delta) {
        counters.computeIfAbsent(counter, ignored -> new AtomicLong()).addAndGet(delta);
    }

    public long counter(String counter) {
        AtomicLong value = counters.get(counter);
        return value == null ? 0L : value.get();
    }

    public void setGauge(String gauge, String label, double value) {
        gauges.computeIfAbsent(gauge, ignored -> new ConcurrentHashMap<>()).put(label, value);
    }

    public void removeGauge(String gauge, String label) {
        Map<String, Double> values = gauges.get(gauge);
        if (values != null) {
            values.remove(label);
        }
    }

    public double gauge(String gauge, String label) {
        Map<String, Double> values = gauges.get(gauge);
        if (values == null) {
            return 0.0;
        }
        return values.getOrDefault(label, 0.0);
    }

    public Snapshot snapshot() {
        Map<String, Long> counterCopy = new TreeMap<>();
        counters.forEach((name, value) -> counterCopy.put(name, value.get()));
        Map<String, Map<String, Double>> gaugeCopy = new TreeMap<>();
        gauges.forEach((name, values) -> gaugeCopy.put(name, Collections.unmodifiableMap(new TreeMap<>(values))));
        return new Snapshot(Collections.unmodifiableMap(counterCopy), Collections.unmodifiableMap(gaugeCopy));
    }

    public record Snapshot(Map<String, Long> counters, Map<String, Map<String, Double>> gauges) {
    }
}
