package io.agenthub.txn;

/**
 * A party that votes during the prepare phase. Returning normally is a commit vote; throwing is an
 * abort vote.
 */
public interface TransactionParticipant {
    void prepare(Transaction transaction) throws Exception;

    default void committed(Transaction transaction) {
    }

    default void aborted(Transaction transaction) {
    }
}
