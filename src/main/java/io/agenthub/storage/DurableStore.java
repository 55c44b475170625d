package io.agenthub.storage;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Versioned key-value store with per-key expiry and pub/sub change notification.
 * <p>
 * Versions start at 1 and grow by one per write. Expired rows read as absent and may be overwritten
 * by {@link #setIfAbsent}. The conditional operations are the only source of truth for lock
 * exclusivity; callers must not rely on any in-memory view.
 */
public interface DurableStore extends AutoCloseable {

    Optional<StoredValue> get(String key);

    /**
     * Unconditional write.
     *
     * @param ttlMs time to live, {@code 0} for none
     */
    StoredValue put(String key, String value, long ttlMs);

    /**
     * Atomically creates the key if it is absent or expired.
     *
     * @return {@code true} if this call created the row
     */
    boolean setIfAbsent(String key, String value, long ttlMs);

    /**
     * Replaces the value only if the live row still carries {@code expectedVersion}.
     */
    boolean compareAndSet(String key, long expectedVersion, String value, long ttlMs);

    boolean delete(String key);

    boolean deleteIfVersion(String key, long expectedVersion);

    /** Live rows whose key starts with {@code prefix}, ordered by key. */
    List<StoredValue> scanPrefix(String prefix);

    /**
     * Every row whose key starts with {@code prefix}, expired rows included, ordered by key. Used by
     * sweeps that must see lapsed leases before {@link #purgeExpired} drops them.
     */
    List<StoredValue> scanPrefixIncludingExpired(String prefix);

    /** Applies every write in one atomic unit; either all land or none. */
    void applyBatch(List<BatchWrite> writes);

    int purgeExpired(long nowMs);

    void publish(String channel, String message);

    /**
     * @param pattern exact channel name, or a prefix ending in {@code *}
     */
    ChangeFeed.Subscription subscribe(String pattern, Consumer<ChangeFeed.FeedMessage> listener);

    @Override
    void close();
}
