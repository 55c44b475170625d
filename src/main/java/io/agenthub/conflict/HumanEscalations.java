package io.agenthub.conflict;

import io.agenthub.observability.AuditLogger;
import io.agenthub.observability.HubMetrics;
import io.agenthub.storage.DurableStore;
import io.agenthub.storage.StoredValue;
import io.agenthub.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.LongSupplier;

/**
 * Queue of decisions the hub refuses to make on its own. Entries live under
 * {@code escalation:{id}} until an operator resolves them.
 */
public final class HumanEscalations {
    private static final Logger log = LoggerFactory.getLogger(HumanEscalations.class);
    private static final String PREFIX = "escalation:";

    private final DurableStore store;
    private final AuditLogger audit;
    private final HubMetrics metrics;
    private final LongSupplier clock;

    public HumanEscalations(DurableStore store, AuditLogger audit, HubMetrics metrics, LongSupplier clock) {
        this.store = store;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Escalation escalate(EscalationKind kind, String resource, List<String> agents, String reason, Map<String, Object> details) {
        Escalation escalation = new Escalation(
                UUID.randomUUID().toString(),
                kind,
                resource,
                agents,
                reason,
                details,
                clock.getAsLong(),
                Escalation.Status.OPEN,
                null
        );
        store.put(PREFIX + escalation.id(), Jsons.toCompactJson(escalation), 0L);
        metrics.increment(HubMetrics.ESCALATIONS);
        audit.log(AuditLogger.AuditEvent.correlated(
                "escalation.open", "hub", resource, kind.name().toLowerCase(Locale.ROOT), escalation.id(),
                Map.of("reason", reason == null ? "" : reason, "agents", escalation.agents())));
        log.warn("escalated to human oversight id={} kind={} resource={} reason={}",
                escalation.id(), kind, resource, reason);
        return escalation;
    }

    public Optional<Escalation> find(String id) {
        return store.get(PREFIX + id).map(HumanEscalations::parse);
    }

    public List<Escalation> list() {
        return store.scanPrefix(PREFIX).stream()
                .map(HumanEscalations::parse)
                .sorted(Comparator.comparingLong(Escalation::createdAtMs))
                .toList();
    }

    public List<Escalation> open() {
        return list().stream().filter(e -> e.status() == Escalation.Status.OPEN).toList();
    }

    public boolean resolve(String id, String resolution, String operator) {
        Optional<StoredValue> row = store.get(PREFIX + id);
        if (row.isEmpty()) {
            return false;
        }
        Escalation current = parse(row.get());
        if (current.status() == Escalation.Status.RESOLVED) {
            return false;
        }
        Escalation done = current.resolved(resolution);
        if (!store.compareAndSet(PREFIX + id, row.get().version(), Jsons.toCompactJson(done), 0L)) {
            return false;
        }
        audit.log(AuditLogger.AuditEvent.correlated(
                "escalation.resolve", operator, current.resource(), "resolved", id,
                Map.of("resolution", resolution == null ? "" : resolution)));
        return true;
    }

    private static Escalation parse(StoredValue row) {
        return Jsons.fromJson(row.value(), Escalation.class);
    }
}
