package io.agenthub.storage;

/**
 * One row of the durable key-value table. {@code expiresAtMs} of zero means the row never expires.
 */
public record StoredValue(
        String key,
        String value,
        long version,
        long updatedAtMs,
        long expiresAtMs
) {
    public boolean isExpired(long nowMs) {
        return expiresAtMs > 0 && expiresAtMs <= nowMs;
    }
}
