package io.agenthub.txn;

public record CommitOutcome(String transactionId, TransactionStatus status, String reason) {
    public boolean committed() {
        return status == TransactionStatus.COMMITTED;
    }
}
