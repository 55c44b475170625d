package io.agenthub.txn;

public enum TransactionStatus {
    PENDING,
    COMMITTED,
    ABORTED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
