package io.agenthub.txn;

import com.fasterxml.jackson.databind.JsonNode;
import io.agenthub.error.ErrorKind;
import io.agenthub.error.HubException;
import io.agenthub.lock.LockManager;
import io.agenthub.lock.LockOutcome;
import io.agenthub.lock.LockType;
import io.agenthub.observability.AuditLogger;
import io.agenthub.observability.HubMetrics;
import io.agenthub.storage.DurableStore;
import io.agenthub.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Two-phase commit over locked state keys and registered participants.
 * <p>
 * Prepare takes an exclusive lease on every key the operation log touches and then collects one
 * vote per participant. Only a unanimous prepare reaches the applier. Once a transaction is
 * committed or aborted, further commit and rollback calls return the terminal status unchanged.
 */
public final class TransactionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(TransactionCoordinator.class);
    private static final long TERMINAL_RETENTION_MS = 24L * 60L * 60L * 1000L;
    static final String SCOPE_WIDE_KEY = "*";

    private final DurableStore store;
    private final LockManager locks;
    private final TransactionApplier applier;
    private final AuditLogger audit;
    private final HubMetrics metrics;
    private final long lockLeaseMs;
    private final LongSupplier clock;
    private final Map<String, Transaction> transactions = new ConcurrentHashMap<>();
    private final Map<String, Object> monitors = new ConcurrentHashMap<>();
    private final Map<String, TransactionParticipant> participants = new ConcurrentHashMap<>();

    public TransactionCoordinator(
            DurableStore store,
            LockManager locks,
            TransactionApplier applier,
            AuditLogger audit,
            HubMetrics metrics,
            long lockLeaseMs,
            LongSupplier clock
    ) {
        this.store = store;
        this.locks = locks;
        this.applier = applier;
        this.audit = audit;
        this.metrics = metrics;
        this.lockLeaseMs = lockLeaseMs;
        this.clock = clock;
    }

    public static String storeKey(String transactionId) {
        return "transaction:" + transactionId;
    }

    public void registerParticipant(String participantId, TransactionParticipant participant) {
        participants.put(participantId, participant);
    }

    public void unregisterParticipant(String participantId) {
        participants.remove(participantId);
    }

    public String begin(String coordinator, List<String> participantIds, long timeoutMs) {
        if (coordinator == null || coordinator.isBlank()) {
            throw new HubException(ErrorKind.VALIDATION, "transaction coordinator must not be blank");
        }
        if (timeoutMs <= 0) {
            throw new HubException(ErrorKind.VALIDATION, "transaction timeout must be positive");
        }
        long nowMs = clock.getAsLong();
        String id = UUID.randomUUID().toString();
        Transaction txn = new Transaction(
                id,
                coordinator,
                participantIds,
                List.of(),
                TransactionStatus.PENDING,
                Map.of(),
                nowMs,
                nowMs + timeoutMs,
                0L,
                null
        );
        transactions.put(id, txn);
        persist(txn);
        log.debug("transaction begun id={} coordinator={} participants={} timeout_ms={}",
                id, coordinator, txn.participants(), timeoutMs);
        return id;
    }

    /**
     * Queues an operation. Returns {@code false} if the transaction is no longer pending.
     */
    public boolean addOperation(String transactionId, OperationType type, String scope, String key, JsonNode value, String agentId) {
        if (type == null || scope == null || scope.isBlank()) {
            throw new HubException(ErrorKind.VALIDATION, "operation type and scope are required");
        }
        if (type != OperationType.CLEAR_SCOPE && (key == null || key.isBlank())) {
            throw new HubException(ErrorKind.VALIDATION, "operation key must not be blank for " + type);
        }
        synchronized (monitor(transactionId)) {
            Transaction txn = require(transactionId);
            if (txn.status() != TransactionStatus.PENDING) {
                return false;
            }
            if (txn.isExpired(clock.getAsLong())) {
                abortLocked(txn, "timeout");
                return false;
            }
            Transaction next = txn.withOperation(new TransactionOperation(type, scope, key, value, agentId));
            transactions.put(transactionId, next);
            persist(next);
            return true;
        }
    }

    public CommitOutcome commit(String transactionId) {
        synchronized (monitor(transactionId)) {
            Transaction txn = require(transactionId);
            if (txn.status().isTerminal()) {
                return new CommitOutcome(transactionId, txn.status(), txn.reason());
            }
            if (txn.isExpired(clock.getAsLong())) {
                return abortLocked(txn, "timeout");
            }
            String owner = lockOwner(transactionId);
            try {
                for (String[] target : lockTargets(txn)) {
                    LockOutcome lock = locks.acquire(target[0], target[1], LockType.EXCLUSIVE, owner, lockLeaseMs);
                    if (!lock.granted()) {
                        return abortLocked(txn, "prepare failed: " + lock.lockKey() + " " + lock.reason());
                    }
                }
                Map<String, Boolean> votes = new LinkedHashMap<>();
                String rejectedBy = null;
                for (String participantId : txn.participants()) {
                    TransactionParticipant participant = participants.get(participantId);
                    boolean vote = true;
                    if (participant != null) {
                        try {
                            participant.prepare(txn);
                        } catch (Exception e) {
                            log.warn("participant voted abort txn={} participant={} error={}",
                                    transactionId, participantId, e.getMessage());
                            vote = false;
                        }
                    }
                    votes.put(participantId, vote);
                    if (!vote) {
                        rejectedBy = participantId;
                        break;
                    }
                }
                txn = txn.withVotes(votes);
                transactions.put(transactionId, txn);
                if (rejectedBy != null) {
                    return abortLocked(txn, "prepare failed: participant " + rejectedBy + " voted abort");
                }
                try {
                    applier.apply(txn, txn.operations());
                } catch (RuntimeException e) {
                    log.error("commit phase failed txn={}", transactionId, e);
                    return abortLocked(txn, "commit phase failed: " + e.getMessage());
                }
                Transaction done = txn.finished(TransactionStatus.COMMITTED, clock.getAsLong(), null);
                transactions.put(transactionId, done);
                persist(done);
                metrics.increment(HubMetrics.TRANSACTIONS_COMMITTED);
                audit.log(AuditLogger.AuditEvent.correlated(
                        "transaction.commit", done.coordinator(), storeKey(transactionId), "committed", transactionId,
                        Map.of("operations", done.operations().size(), "participants", done.participants())));
                notifyParticipants(done, true);
                log.info("transaction committed id={} operations={}", transactionId, done.operations().size());
                return new CommitOutcome(transactionId, TransactionStatus.COMMITTED, null);
            } finally {
                locks.releaseAll(owner);
            }
        }
    }

    public CommitOutcome rollback(String transactionId) {
        synchronized (monitor(transactionId)) {
            Transaction txn = require(transactionId);
            if (txn.status().isTerminal()) {
                return new CommitOutcome(transactionId, txn.status(), txn.reason());
            }
            return abortLocked(txn, "rolled back");
        }
    }

    public Optional<Transaction> find(String transactionId) {
        Transaction txn = transactions.get(transactionId);
        if (txn != null) {
            return Optional.of(txn);
        }
        return store.get(storeKey(transactionId)).map(row -> Jsons.fromJson(row.value(), Transaction.class));
    }

    public List<Transaction> pending() {
        return transactions.values().stream()
                .filter(t -> t.status() == TransactionStatus.PENDING)
                .toList();
    }

    public int abortExpired() {
        return abortExpired(clock.getAsLong());
    }

    /**
     * Aborts every pending transaction whose timeout has passed; terminal ones older than the
     * retention window are dropped from memory.
     */
    public int abortExpired(long nowMs) {
        int aborted = 0;
        for (Transaction candidate : new ArrayList<>(transactions.values())) {
            if (candidate.status().isTerminal()) {
                if (nowMs - candidate.finishedAtMs() > TERMINAL_RETENTION_MS) {
                    transactions.remove(candidate.id());
                    monitors.remove(candidate.id());
                }
                continue;
            }
            if (!candidate.isExpired(nowMs)) {
                continue;
            }
            synchronized (monitor(candidate.id())) {
                Transaction current = transactions.get(candidate.id());
                if (current != null && current.isExpired(nowMs)) {
                    abortLocked(current, "timeout");
                    aborted++;
                }
            }
        }
        return aborted;
    }

    private CommitOutcome abortLocked(Transaction txn, String reason) {
        Transaction done = txn.finished(TransactionStatus.ABORTED, clock.getAsLong(), reason);
        transactions.put(txn.id(), done);
        persist(done);
        locks.releaseAll(lockOwner(txn.id()));
        metrics.increment(HubMetrics.TRANSACTIONS_ABORTED);
        audit.log(AuditLogger.AuditEvent.correlated(
                "transaction.abort", txn.coordinator(), storeKey(txn.id()), "aborted", txn.id(),
                Map.of("reason", reason, "operations", txn.operations().size())));
        notifyParticipants(done, false);
        log.warn("transaction aborted id={} reason={}", txn.id(), reason);
        return new CommitOutcome(txn.id(), TransactionStatus.ABORTED, reason);
    }

    private void notifyParticipants(Transaction txn, boolean committed) {
        for (String participantId : txn.participants()) {
            TransactionParticipant participant = participants.get(participantId);
            if (participant == null) {
                continue;
            }
            try {
                if (committed) {
                    participant.committed(txn);
                } else {
                    participant.aborted(txn);
                }
            } catch (RuntimeException e) {
                log.warn("participant notification failed txn={} participant={}", txn.id(), participantId, e);
            }
        }
    }

    private static List<String[]> lockTargets(Transaction txn) {
        Set<String> seen = new LinkedHashSet<>();
        List<String[]> out = new ArrayList<>();
        for (TransactionOperation op : txn.operations()) {
            String key = op.type() == OperationType.CLEAR_SCOPE ? SCOPE_WIDE_KEY : op.key();
            if (seen.add(op.scope() + "\u0000" + key)) {
                out.add(new String[]{op.scope(), key});
            }
        }
        return out;
    }

    private Transaction require(String transactionId) {
        return find(transactionId).map(found -> {
            transactions.putIfAbsent(transactionId, found);
            return transactions.get(transactionId);
        }).orElseThrow(() -> new HubException(ErrorKind.VALIDATION, "Unknown transaction: " + transactionId));
    }

    private Object monitor(String transactionId) {
        if (transactionId == null) {
            throw new HubException(ErrorKind.VALIDATION, "transaction id must not be null");
        }
        return monitors.computeIfAbsent(transactionId, ignored -> new Object());
    }

    private void persist(Transaction txn) {
        long ttl = txn.status().isTerminal() ? TERMINAL_RETENTION_MS : 0L;
        store.put(storeKey(txn.id()), Jsons.toCompactJson(txn), ttl);
    }

    static String lockOwner(String transactionId) {
        return "txn:" + transactionId;
    }
}
