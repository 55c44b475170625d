package io.agenthub.state;

import io.agenthub.error.ErrorKind;
import io.agenthub.error.HubException;
import io.agenthub.observability.AuditLogger;
import io.agenthub.storage.DurableStore;
import io.agenthub.txn.CommitOutcome;
import io.agenthub.txn.OperationType;
import io.agenthub.txn.TransactionCoordinator;
import io.agenthub.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Named snapshots of one scope. A restore runs as a transaction that clears the scope and writes
 * the snapshot back with its original versions; if the transaction aborts, the scope is untouched.
 */
public final class CheckpointService {
    private static final Logger log = LoggerFactory.getLogger(CheckpointService.class);
    public static final String COORDINATOR = "state_store";
    public static final long RESTORE_TIMEOUT_MS = 10L * 60L * 1000L;

    private final StateStore state;
    private final TransactionCoordinator transactions;
    private final DurableStore store;
    private final AuditLogger audit;
    private final LongSupplier clock;

    public CheckpointService(StateStore state, TransactionCoordinator transactions, DurableStore store,
                             AuditLogger audit, LongSupplier clock) {
        this.state = state;
        this.transactions = transactions;
        this.store = store;
        this.audit = audit;
        this.clock = clock;
    }

    public Checkpoint create(String name, Scope scope) {
        if (name == null || name.isBlank()) {
            throw new HubException(ErrorKind.VALIDATION, "checkpoint name must not be blank");
        }
        Checkpoint checkpoint = new Checkpoint(name.trim(), scope, clock.getAsLong(), state.snapshot(scope));
        store.put(Checkpoint.storeKey(scope, checkpoint.name()), Jsons.toCompactJson(checkpoint), 0L);
        audit.log(AuditLogger.AuditEvent.of(
                "checkpoint.create", COORDINATOR, Checkpoint.storeKey(scope, checkpoint.name()), "ok",
                Map.of("entries", checkpoint.entries().size())));
        log.info("checkpoint created name={} scope={} entries={}", checkpoint.name(), scope.wireName(), checkpoint.entries().size());
        return checkpoint;
    }

    public Optional<Checkpoint> find(String name, Scope scope) {
        return store.get(Checkpoint.storeKey(scope, name)).map(row -> Jsons.fromJson(row.value(), Checkpoint.class));
    }

    public List<Checkpoint> list(Scope scope) {
        return store.scanPrefix("checkpoint:" + scope.wireName() + ":").stream()
                .map(row -> Jsons.fromJson(row.value(), Checkpoint.class))
                .toList();
    }

    public RestoreOutcome restore(String name, Scope scope) {
        Optional<Checkpoint> found = find(name, scope);
        if (found.isEmpty()) {
            log.warn("checkpoint not found name={} scope={}", name, scope.wireName());
            return new RestoreOutcome(false, name, scope, 0, null, "checkpoint not found");
        }
        Checkpoint checkpoint = found.get();
        long nowMs = clock.getAsLong();
        // Entries whose TTL ran out since the snapshot stay gone.
        List<StateEntry> live = checkpoint.entries().stream().filter(entry -> !entry.isExpired(nowMs)).toList();
        String txId = transactions.begin(COORDINATOR, List.of(COORDINATOR), RESTORE_TIMEOUT_MS);
        transactions.addOperation(txId, OperationType.CLEAR_SCOPE, scope.wireName(), null, null, COORDINATOR);
        for (StateEntry entry : live) {
            transactions.addOperation(txId, OperationType.RESTORE_ENTRY, scope.wireName(), entry.key(),
                    Jsons.toTree(entry), COORDINATOR);
        }
        CommitOutcome outcome = transactions.commit(txId);
        audit.log(AuditLogger.AuditEvent.correlated(
                "checkpoint.restore", COORDINATOR, Checkpoint.storeKey(scope, name),
                outcome.committed() ? "ok" : "aborted", txId,
                Map.of("entries", live.size(), "lapsed", checkpoint.entries().size() - live.size())));
        if (!outcome.committed()) {
            log.warn("checkpoint restore aborted name={} scope={} reason={}", name, scope.wireName(), outcome.reason());
            return new RestoreOutcome(false, name, scope, 0, txId, outcome.reason());
        }
        log.info("checkpoint restored name={} scope={} entries={} lapsed={}",
                name, scope.wireName(), live.size(), checkpoint.entries().size() - live.size());
        return new RestoreOutcome(true, name, scope, live.size(), txId, null);
    }
}
