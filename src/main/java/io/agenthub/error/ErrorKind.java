package io.agenthub.error;

/**
 * Failure taxonomy shared by the bus, the router and the state layer.
 *
 * <p>Transient kinds ({@link #DELIVERY_FAILURE}, {@link #LOCK_CONTENTION}) are retried locally with
 * bounded backoff. Structural kinds are surfaced to the caller as is.
 */
public enum ErrorKind {
    VALIDATION(false),
    ROUTING(false),
    DELIVERY_FAILURE(true),
    DEAD_LETTERED(false),
    LOCK_CONTENTION(true),
    TRANSACTION_ABORTED(false),
    CONSISTENCY_VIOLATION(false);

    private final boolean transientFailure;

    ErrorKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
