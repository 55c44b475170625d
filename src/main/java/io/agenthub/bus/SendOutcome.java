package io.agenthub.bus;

public record SendOutcome(Status status, String messageId, String reason) {
    public enum Status {
        DELIVERED,
        QUEUED,
        REJECTED,
        DEAD_LETTERED
    }

    public boolean accepted() {
        return status == Status.DELIVERED || status == Status.QUEUED;
    }

    static SendOutcome delivered(String messageId) {
        return new SendOutcome(Status.DELIVERED, messageId, null);
    }

    static SendOutcome queued(String messageId, String reason) {
        return new SendOutcome(Status.QUEUED, messageId, reason);
    }

    static SendOutcome rejected(String messageId, String reason) {
        return new SendOutcome(Status.REJECTED, messageId, reason);
    }

    static SendOutcome deadLettered(String messageId, String reason) {
        return new SendOutcome(Status.DEAD_LETTERED, messageId, reason);
    }
}
