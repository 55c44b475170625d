package io.agenthub.state;

public record DeleteOutcome(Status status, String key, Scope scope, String reason) {
    public enum Status {
        DELETED,
        NOT_FOUND,
        LOCKED,
        DENIED
    }

    public boolean deleted() {
        return status == Status.DELETED;
    }
}
