package io.agenthub.lock;

import com.fasterxml.jackson.core.type.TypeReference;
import io.agenthub.observability.HubMetrics;
import io.agenthub.storage.DurableStore;
import io.agenthub.storage.StoredValue;
import io.agenthub.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Lease-based locks kept under {@code lock:{scope}:{key}} in the durable store.
 * <p>
 * Each lock row holds the list of current holders. Every grant and release is a single
 * set-if-absent or compare-and-set on that row, so the store decides exclusivity even when several
 * hubs share it. The per-owner index kept here is advisory and only used for bulk release.
 */
public final class LockManager {
    private static final Logger log = LoggerFactory.getLogger(LockManager.class);
    private static final TypeReference<List<LockHolder>> HOLDERS = new TypeReference<>() {
    };
    private static final int MAX_CAS_ATTEMPTS = 32;
    private static final long MIN_BACKOFF_MS = 5L;
    private static final long MAX_BACKOFF_MS = 250L;

    private final DurableStore store;
    private final HubMetrics metrics;
    private final LongSupplier clock;
    private final Map<String, Set<String>> heldByOwner = new ConcurrentHashMap<>();

    public LockManager(DurableStore store, HubMetrics metrics) {
        this(store, metrics, System::currentTimeMillis);
    }

    public LockManager(DurableStore store, HubMetrics metrics, LongSupplier clock) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
    }

    public static String lockKey(String scope, String key) {
        return "lock:" + scope + ":" + key;
    }

    public LockOutcome acquire(String scope, String key, LockType type, String owner, long durationMs) {
        return acquire(scope, key, type, owner, durationMs, clock.getAsLong());
    }

    public LockOutcome acquire(String scope, String key, LockType type, String owner, long durationMs, long nowMs) {
        requireOwner(owner);
        if (durationMs <= 0) {
            throw new IllegalArgumentException("lock duration must be positive");
        }
        String lockKey = lockKey(scope, key);
        for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
            Optional<StoredValue> current = store.get(lockKey);
            if (current.isEmpty()) {
                LockHolder holder = new LockHolder(UUID.randomUUID().toString(), owner, type, nowMs, nowMs + durationMs, true);
                if (store.setIfAbsent(lockKey, Jsons.toCompactJson(List.of(holder)), durationMs)) {
                    // A fresh row means any earlier holder's lease had lapsed.
                    forgetOthers(lockKey, owner);
                    return recordGrant(lockKey, holder);
                }
                continue;
            }
            StoredValue row = current.get();
            List<LockHolder> others = new ArrayList<>();
            LockHolder mine = null;
            for (LockHolder holder : parseHolders(row)) {
                if (!holder.isLive(nowMs)) {
                    continue;
                }
                if (holder.owner().equals(owner)) {
                    mine = holder;
                } else {
                    others.add(holder);
                }
            }
            for (LockHolder other : others) {
                if (!type.compatibleWith(other.type())) {
                    metrics.increment(HubMetrics.LOCKS_DENIED);
                    log.debug("lock denied key={} type={} owner={} held_by={} held_type={}",
                            lockKey, type, owner, other.owner(), other.type());
                    return LockOutcome.denied(lockKey, owner, type, other.owner(), "held by " + other.owner());
                }
            }
            LockHolder granted = mine == null
                    ? new LockHolder(UUID.randomUUID().toString(), owner, type, nowMs, nowMs + durationMs, true)
                    : mine.renewed(type, nowMs, durationMs);
            List<LockHolder> next = new ArrayList<>(others);
            next.add(granted);
            if (store.compareAndSet(lockKey, row.version(), Jsons.toCompactJson(next), rowTtl(next, nowMs))) {
                forgetExpired(parseHolders(row), lockKey, nowMs);
                return recordGrant(lockKey, granted);
            }
        }
        metrics.increment(HubMetrics.LOCKS_DENIED);
        return LockOutcome.denied(lockKey, owner, type, null, "contention");
    }

    /**
     * Retries {@link #acquire} with exponential backoff until granted or {@code maxWaitMs} elapses.
     */
    public LockOutcome acquireWithBackoff(String scope, String key, LockType type, String owner, long durationMs, long maxWaitMs) {
        long deadline = System.currentTimeMillis() + Math.max(0L, maxWaitMs);
        long backoff = MIN_BACKOFF_MS;
        while (true) {
            LockOutcome outcome = acquire(scope, key, type, owner, durationMs);
            if (outcome.granted() || System.currentTimeMillis() + backoff > deadline) {
                return outcome;
            }
            try {
                Thread.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return outcome;
            }
            backoff = Math.min(MAX_BACKOFF_MS, backoff * 2);
        }
    }

    /**
     * Extends the caller's lease without changing its type.
     */
    public LockOutcome renew(String scope, String key, String owner, long durationMs) {
        long nowMs = clock.getAsLong();
        Optional<LockHolder> held = holders(scope, key, nowMs).stream()
                .filter(h -> h.owner().equals(owner))
                .findFirst();
        if (held.isEmpty()) {
            return LockOutcome.denied(lockKey(scope, key), owner, null, null, "not held");
        }
        if (!held.get().renewable()) {
            return LockOutcome.denied(lockKey(scope, key), owner, held.get().type(), null, "not renewable");
        }
        return acquire(scope, key, held.get().type(), owner, durationMs, nowMs);
    }

    public boolean release(String scope, String key, String owner) {
        return releaseKey(lockKey(scope, key), owner, clock.getAsLong());
    }

    /**
     * Releases every lock this hub granted to {@code owner}. Locks it cannot reach are left to expire.
     */
    public int releaseAll(String owner) {
        Set<String> keys = heldByOwner.remove(owner);
        if (keys == null) {
            return 0;
        }
        int released = 0;
        long nowMs = clock.getAsLong();
        for (String lockKey : Set.copyOf(keys)) {
            if (releaseKey(lockKey, owner, nowMs)) {
                released++;
            }
        }
        return released;
    }

    public List<LockHolder> holders(String scope, String key) {
        return holders(scope, key, clock.getAsLong());
    }

    public List<LockHolder> holders(String scope, String key, long nowMs) {
        return store.get(lockKey(scope, key))
                .map(row -> parseHolders(row).stream().filter(h -> h.isLive(nowMs)).toList())
                .orElse(List.of());
    }

    public int reclaimExpired() {
        return reclaimExpired(clock.getAsLong());
    }

    /**
     * Drops expired holders from every lock row, deleting rows left empty. Rows whose whole lease
     * has lapsed are visited too, before the store purges them.
     */
    public int reclaimExpired(long nowMs) {
        int reclaimed = 0;
        for (StoredValue row : store.scanPrefixIncludingExpired("lock:")) {
            List<LockHolder> holders = parseHolders(row);
            List<LockHolder> live = holders.stream().filter(h -> h.isLive(nowMs)).toList();
            if (live.size() == holders.size()) {
                continue;
            }
            boolean applied = live.isEmpty()
                    ? store.deleteIfVersion(row.key(), row.version())
                    : store.compareAndSet(row.key(), row.version(), Jsons.toCompactJson(live), rowTtl(live, nowMs));
            if (applied) {
                int dropped = holders.size() - live.size();
                reclaimed += dropped;
                forgetExpired(holders, row.key(), nowMs);
                log.info("reclaimed expired lock key={} holders={}", row.key(), dropped);
            }
        }
        if (reclaimed > 0) {
            metrics.add(HubMetrics.LOCKS_RECLAIMED, reclaimed);
        }
        return reclaimed;
    }

    private boolean releaseKey(String lockKey, String owner, long nowMs) {
        for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
            Optional<StoredValue> current = store.get(lockKey);
            if (current.isEmpty()) {
                forget(owner, lockKey);
                return false;
            }
            StoredValue row = current.get();
            List<LockHolder> holders = parseHolders(row);
            if (holders.stream().noneMatch(h -> h.owner().equals(owner))) {
                return false;
            }
            List<LockHolder> remaining = holders.stream()
                    .filter(h -> !h.owner().equals(owner) && h.isLive(nowMs))
                    .toList();
            boolean applied = remaining.isEmpty()
                    ? store.deleteIfVersion(lockKey, row.version())
                    : store.compareAndSet(lockKey, row.version(), Jsons.toCompactJson(remaining), rowTtl(remaining, nowMs));
            if (applied) {
                forget(owner, lockKey);
                log.debug("lock released key={} owner={}", lockKey, owner);
                return true;
            }
        }
        log.warn("lock release lost every compare-and-set round key={} owner={}", lockKey, owner);
        return false;
    }

    private LockOutcome recordGrant(String lockKey, LockHolder holder) {
        heldByOwner.computeIfAbsent(holder.owner(), ignored -> ConcurrentHashMap.newKeySet()).add(lockKey);
        metrics.increment(HubMetrics.LOCKS_GRANTED);
        log.debug("lock granted key={} type={} owner={} expires_at_ms={}",
                lockKey, holder.type(), holder.owner(), holder.expiresAtMs());
        return LockOutcome.granted(lockKey, holder);
    }

    private void forget(String owner, String lockKey) {
        heldByOwner.computeIfPresent(owner, (ignored, keys) -> {
            keys.remove(lockKey);
            return keys.isEmpty() ? null : keys;
        });
    }

    private void forgetExpired(List<LockHolder> holders, String lockKey, long nowMs) {
        for (LockHolder holder : holders) {
            if (!holder.isLive(nowMs)) {
                forget(holder.owner(), lockKey);
            }
        }
    }

    private void forgetOthers(String lockKey, String owner) {
        for (String tracked : List.copyOf(heldByOwner.keySet())) {
            if (!tracked.equals(owner)) {
                forget(tracked, lockKey);
            }
        }
    }

    /** Owners this hub currently tracks as holding at least one lock. */
    int trackedOwners() {
        return heldByOwner.size();
    }

    private static long rowTtl(List<LockHolder> holders, long nowMs) {
        long maxExpiry = holders.stream().mapToLong(LockHolder::expiresAtMs).max().orElse(nowMs + 1);
        return Math.max(1L, maxExpiry - nowMs);
    }

    private static List<LockHolder> parseHolders(StoredValue row) {
        try {
            return Jsons.mapper().readValue(row.value(), HOLDERS);
        } catch (IOException e) {
            throw new IllegalStateException("Corrupt lock row: " + row.key(), e);
        }
    }

    private static void requireOwner(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("lock owner must not be blank");
        }
    }
}
