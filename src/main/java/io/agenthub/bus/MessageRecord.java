package io.agenthub.bus;

import io.agenthub.model.Message;

/**
 * Audit copy of a message kept under {@code message:{id}} (or {@code dead_letter:{id}}).
 */
public record MessageRecord(Message message, String state, String lastError, long updatedAtMs) {
    public static final String QUEUED = "queued";
    public static final String DELIVERED = "delivered";
    public static final String RETRYING = "retrying";
    public static final String REJECTED = "rejected";
    public static final String EXPIRED = "expired";
    public static final String DEAD_LETTERED = "dead_lettered";
}
