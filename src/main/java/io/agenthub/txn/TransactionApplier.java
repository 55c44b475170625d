package io.agenthub.txn;

import java.util.List;

/**
 * Applies the queued operations of a prepared transaction. Must be all-or-nothing.
 */
@FunctionalInterface
public interface TransactionApplier {
    void apply(Transaction transaction, List<TransactionOperation> operations);
}
