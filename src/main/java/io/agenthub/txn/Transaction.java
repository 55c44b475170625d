package io.agenthub.txn;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted view of one two-phase-commit transaction. Instances are immutable; the coordinator
 * replaces them as the transaction advances.
 */
public record Transaction(
        String id,
        String coordinator,
        List<String> participants,
        List<TransactionOperation> operations,
        TransactionStatus status,
        Map<String, Boolean> votes,
        long createdAtMs,
        long timeoutAtMs,
        long finishedAtMs,
        String reason
) {
    public Transaction {
        participants = participants == null ? List.of() : List.copyOf(participants);
        operations = operations == null ? List.of() : List.copyOf(operations);
        votes = votes == null ? Map.of() : Map.copyOf(votes);
    }

    public boolean isExpired(long nowMs) {
        return status == TransactionStatus.PENDING && nowMs > timeoutAtMs;
    }

    Transaction withOperation(TransactionOperation operation) {
        List<TransactionOperation> next = new ArrayList<>(operations);
        next.add(operation);
        return new Transaction(id, coordinator, participants, next, status, votes, createdAtMs, timeoutAtMs, finishedAtMs, reason);
    }

    Transaction withVotes(Map<String, Boolean> newVotes) {
        return new Transaction(id, coordinator, participants, operations, status, new LinkedHashMap<>(newVotes),
                createdAtMs, timeoutAtMs, finishedAtMs, reason);
    }

    Transaction finished(TransactionStatus terminal, long nowMs, String why) {
        return new Transaction(id, coordinator, participants, operations, terminal, votes, createdAtMs, timeoutAtMs, nowMs, why);
    }
}
