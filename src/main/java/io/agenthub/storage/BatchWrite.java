package io.agenthub.storage;

/**
 * One mutation inside an atomic {@link DurableStore#applyBatch(java.util.List)} call.
 */
public record BatchWrite(Kind kind, String key, String value, long version, long ttlMs) {
    public enum Kind {
        PUT,
        PUT_VERSIONED,
        DELETE,
        DELETE_PREFIX
    }

    /** Writes {@code value}, bumping the stored version by one (or starting at 1). */
    public static BatchWrite put(String key, String value, long ttlMs) {
        return new BatchWrite(Kind.PUT, key, value, 0L, ttlMs);
    }

    /** Writes {@code value} with an explicit version, used when restoring snapshots. */
    public static BatchWrite putVersioned(String key, String value, long version, long ttlMs) {
        return new BatchWrite(Kind.PUT_VERSIONED, key, value, version, ttlMs);
    }

    public static BatchWrite delete(String key) {
        return new BatchWrite(Kind.DELETE, key, null, 0L, 0L);
    }

    public static BatchWrite deletePrefix(String prefix) {
        return new BatchWrite(Kind.DELETE_PREFIX, prefix, null, 0L, 0L);
    }
}
