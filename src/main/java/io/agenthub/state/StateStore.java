package io.agenthub.state;

import com.fasterxml.jackson.databind.JsonNode;
import io.agenthub.conflict.ConflictResolver;
import io.agenthub.conflict.ConflictStrategy;
import io.agenthub.conflict.Resolution;
import io.agenthub.error.ErrorKind;
import io.agenthub.error.HubException;
import io.agenthub.lock.LockManager;
import io.agenthub.lock.LockOutcome;
import io.agenthub.lock.LockType;
import io.agenthub.observability.HubMetrics;
import io.agenthub.storage.BatchWrite;
import io.agenthub.storage.ChangeFeed;
import io.agenthub.storage.DurableStore;
import io.agenthub.storage.StoredValue;
import io.agenthub.txn.Transaction;
import io.agenthub.txn.TransactionOperation;
import io.agenthub.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongSupplier;

/**
 * Versioned, scoped state shared by every agent.
 * <p>
 * Entries live under {@code state:{scope}:{key}}. Every write is a compare-and-set on the row
 * version, so versions grow by exactly one per accepted write. Strong reads and writes hold an
 * exclusive lease on the key and never touch the cache; eventual and weak reads are served from the
 * cache, which is invalidated from the {@code state_changes:{scope}} channels.
 * <p>
 * Writes and deletes are checked against the entry's {@link AccessLevel}. Reads that name the
 * requesting agent are checked too; reads without one are hub-internal and unchecked.
 */
public final class StateStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StateStore.class);
    private static final int MAX_CAS_ATTEMPTS = 32;
    private static final String PREFIX = "state:";

    private final DurableStore store;
    private final LockManager locks;
    private final ConflictResolver resolver;
    private final StateAccessPolicy access;
    private final HubMetrics metrics;
    private final LongSupplier clock;
    private final long lockLeaseMs;
    private final long lockWaitMs;
    private final Map<String, StateEntry> cache = new ConcurrentHashMap<>();
    private final List<ListenerRegistration> listeners = new CopyOnWriteArrayList<>();
    private final ChangeFeed.Subscription invalidation;

    public StateStore(
            DurableStore store,
            LockManager locks,
            ConflictResolver resolver,
            HubMetrics metrics,
            long lockLeaseMs,
            long lockWaitMs,
            LongSupplier clock
    ) {
        this.store = store;
        this.locks = locks;
        this.resolver = resolver;
        this.access = new StateAccessPolicy(resolver.priorities());
        this.metrics = metrics;
        this.lockLeaseMs = lockLeaseMs;
        this.lockWaitMs = lockWaitMs;
        this.clock = clock;
        this.invalidation = store.subscribe("state_changes:*", this::onRemoteChange);
    }

    public static String storeKey(Scope scope, String key) {
        return PREFIX + scope.wireName() + ":" + key;
    }

    public WriteOutcome set(String key, JsonNode value, Scope scope, String owner) {
        return set(key, value, scope, StateType.CONFIGURATION, owner, ConsistencyLevel.EVENTUAL, null, ConflictStrategy.LAST_WRITER_WINS);
    }

    public WriteOutcome set(String key, JsonNode value, Scope scope, String owner,
                            ConsistencyLevel consistency, Long ttlMs, ConflictStrategy strategy) {
        return set(key, value, scope, StateType.CONFIGURATION, owner, consistency, ttlMs, strategy);
    }

    public WriteOutcome set(String key, JsonNode value, Scope scope, StateType stateType, String owner,
                            ConsistencyLevel consistency, Long ttlMs, ConflictStrategy strategy) {
        return set(key, value, scope, stateType, null, owner, consistency, ttlMs, strategy);
    }

    /**
     * Writes {@code value} as {@code owner}. A null {@code accessLevel} keeps the level of the entry
     * being overwritten, or {@link AccessLevel#PUBLIC} for a new one.
     */
    public WriteOutcome set(String key, JsonNode value, Scope scope, StateType stateType, AccessLevel accessLevel,
                            String owner, ConsistencyLevel consistency, Long ttlMs, ConflictStrategy strategy) {
        requireKey(key, scope);
        if (owner == null || owner.isBlank()) {
            throw new HubException(ErrorKind.VALIDATION, "owner agent must not be blank");
        }
        ConsistencyLevel level = consistency == null ? ConsistencyLevel.EVENTUAL : consistency;
        ConflictStrategy effective = strategy == null ? ConflictStrategy.LAST_WRITER_WINS : strategy;
        boolean strong = level == ConsistencyLevel.STRONG;
        if (strong) {
            LockOutcome lock = locks.acquireWithBackoff(scope.wireName(), key, LockType.EXCLUSIVE, owner, lockLeaseMs, lockWaitMs);
            if (!lock.granted()) {
                metrics.increment(HubMetrics.STATE_WRITES_REJECTED);
                log.warn("strong write could not lock key={} scope={} owner={}", key, scope.wireName(), owner);
                return WriteOutcome.rejected(key, scope, currentVersion(scope, key), effective, "lock contention");
            }
        }
        try {
            return writeLoop(key, value, scope, stateType, accessLevel, owner, level, ttlMs, effective);
        } finally {
            if (strong) {
                locks.release(scope.wireName(), key, owner);
            }
        }
    }

    private WriteOutcome writeLoop(String key, JsonNode value, Scope scope, StateType stateType, AccessLevel accessLevel,
                                   String owner, ConsistencyLevel level, Long ttlMs, ConflictStrategy strategy) {
        String storeKey = storeKey(scope, key);
        long ttl = ttlMs == null || ttlMs <= 0 ? 0L : ttlMs;
        JsonNode incoming = value == null ? Jsons.mapper().nullNode() : value;
        for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
            long nowMs = clock.getAsLong();
            Optional<StoredValue> row = store.get(storeKey);
            if (row.isEmpty()) {
                StateEntry created = newEntry(key, scope, incoming, owner, 1L, nowMs, nowMs, ttl, level, stateType, accessLevel);
                if (!access.canWrite(owner, created)) {
                    return denied(key, scope, 0L, strategy, owner, created);
                }
                if (store.setIfAbsent(storeKey, Jsons.toCompactJson(created), ttl)) {
                    long version = store.get(storeKey).map(StoredValue::version).orElse(1L);
                    return accepted(created.withVersion(version), strategy);
                }
                continue;
            }
            StateEntry existing = parse(row.get());
            if (!access.canWrite(owner, existing)) {
                return denied(key, scope, existing.version(), strategy, owner, existing);
            }
            Resolution resolution = resolver.resolve(
                    strategy, storeKey, existing.value(), existing.ownerAgent(), incoming, owner);
            if (!resolution.accepted()) {
                metrics.increment(HubMetrics.STATE_WRITES_REJECTED);
                return WriteOutcome.rejected(key, scope, existing.version(), strategy, resolution.reason());
            }
            long nextVersion = existing.version() + 1;
            StateEntry next = newEntry(key, scope, resolution.value(), owner, nextVersion,
                    existing.createdAtMs(), nowMs, ttl, level, stateType,
                    accessLevel == null ? existing.accessLevel() : accessLevel);
            if (store.compareAndSet(storeKey, existing.version(), Jsons.toCompactJson(next), ttl)) {
                return accepted(next, strategy);
            }
        }
        metrics.increment(HubMetrics.STATE_WRITES_REJECTED);
        return WriteOutcome.rejected(key, scope, currentVersion(scope, key), strategy, "write contention");
    }

    private WriteOutcome denied(String key, Scope scope, long version, ConflictStrategy strategy,
                                String agent, StateEntry guarded) {
        metrics.increment(HubMetrics.STATE_WRITES_REJECTED);
        log.warn("write denied key={} scope={} agent={} access={} owner={}",
                key, scope.wireName(), agent, guarded.accessLevel().wireName(), guarded.ownerAgent());
        return WriteOutcome.rejected(key, scope, version, strategy,
                "access denied: " + guarded.accessLevel().wireName() + " entry owned by " + guarded.ownerAgent());
    }

    private WriteOutcome accepted(StateEntry entry, ConflictStrategy strategy) {
        if (entry.consistency() == ConsistencyLevel.STRONG) {
            cache.remove(storeKey(entry.scope(), entry.key()));
        } else {
            cache.put(storeKey(entry.scope(), entry.key()), entry);
        }
        metrics.increment(HubMetrics.STATE_WRITES);
        publish(StateChange.UPDATED, entry.scope(), entry.key(), entry.stateType(), entry.ownerAgent(), entry.version());
        notifyListeners(entry.scope(), entry.key(), entry);
        log.debug("state set key={} scope={} owner={} version={}",
                entry.key(), entry.scope().wireName(), entry.ownerAgent(), entry.version());
        return WriteOutcome.accepted(entry.key(), entry.scope(), entry.version(), strategy);
    }

    public Optional<JsonNode> get(String key, Scope scope) {
        return get(key, scope, ConsistencyLevel.EVENTUAL);
    }

    public Optional<JsonNode> get(String key, Scope scope, ConsistencyLevel consistency) {
        return getEntry(key, scope, consistency).map(StateEntry::value);
    }

    /**
     * Reads on behalf of {@code requestingAgent}. An entry the agent may not read is reported as absent.
     */
    public Optional<JsonNode> get(String key, Scope scope, ConsistencyLevel consistency, String requestingAgent) {
        return getEntry(key, scope, consistency, requestingAgent).map(StateEntry::value);
    }

    public Optional<StateEntry> getEntry(String key, Scope scope, ConsistencyLevel consistency, String requestingAgent) {
        Optional<StateEntry> entry = getEntry(key, scope, consistency);
        if (entry.isPresent() && !access.canRead(requestingAgent, entry.get())) {
            log.warn("read denied key={} scope={} agent={} access={}",
                    key, scope.wireName(), requestingAgent, entry.get().accessLevel().wireName());
            return Optional.empty();
        }
        return entry;
    }

    public Optional<StateEntry> getEntry(String key, Scope scope, ConsistencyLevel consistency) {
        requireKey(key, scope);
        if (consistency == ConsistencyLevel.STRONG) {
            String reader = "reader:" + UUID.randomUUID();
            LockOutcome lock = locks.acquireWithBackoff(scope.wireName(), key, LockType.EXCLUSIVE, reader, lockLeaseMs, lockWaitMs);
            if (!lock.granted()) {
                throw new HubException(ErrorKind.LOCK_CONTENTION,
                        "Strong read could not lock " + storeKey(scope, key) + ": " + lock.reason());
            }
            try {
                return readVerified(key, scope);
            } finally {
                locks.release(scope.wireName(), key, reader);
            }
        }
        String storeKey = storeKey(scope, key);
        StateEntry cached = cache.get(storeKey);
        if (cached != null) {
            if (cached.isExpired(clock.getAsLong())) {
                cache.remove(storeKey, cached);
            } else if (cached.checksumMatches()) {
                return Optional.of(cached);
            } else {
                log.warn("checksum mismatch in cache key={} scope={}", key, scope.wireName());
                return repair(storeKey);
            }
        }
        Optional<StateEntry> loaded = readVerified(key, scope);
        loaded.ifPresent(entry -> cache.put(storeKey, entry));
        return loaded;
    }

    public DeleteOutcome delete(String key, Scope scope, String owner) {
        requireKey(key, scope);
        LockOutcome lock = locks.acquireWithBackoff(scope.wireName(), key, LockType.EXCLUSIVE, owner, lockLeaseMs, lockWaitMs);
        if (!lock.granted()) {
            return new DeleteOutcome(DeleteOutcome.Status.LOCKED, key, scope, lock.reason());
        }
        String storeKey = storeKey(scope, key);
        try {
            for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
                Optional<StoredValue> row = store.get(storeKey);
                if (row.isEmpty()) {
                    cache.remove(storeKey);
                    return new DeleteOutcome(DeleteOutcome.Status.NOT_FOUND, key, scope, null);
                }
                StateEntry existing = parse(row.get());
                if (!access.canWrite(owner, existing)) {
                    log.warn("delete denied key={} scope={} agent={} access={}",
                            key, scope.wireName(), owner, existing.accessLevel().wireName());
                    return new DeleteOutcome(DeleteOutcome.Status.DENIED, key, scope,
                            "access denied: " + existing.accessLevel().wireName() + " entry owned by " + existing.ownerAgent());
                }
                if (store.deleteIfVersion(storeKey, row.get().version())) {
                    cache.remove(storeKey);
                    publish(StateChange.DELETED, scope, key, existing.stateType(), owner, existing.version());
                    notifyListeners(scope, key, null);
                    log.info("state deleted key={} scope={} agent={}", key, scope.wireName(), owner);
                    return new DeleteOutcome(DeleteOutcome.Status.DELETED, key, scope, null);
                }
            }
            return new DeleteOutcome(DeleteOutcome.Status.LOCKED, key, scope, "write contention");
        } finally {
            locks.release(scope.wireName(), key, owner);
        }
    }

    /**
     * Live entries of a scope, optionally narrowed by key prefix and owner.
     */
    public List<StateEntry> query(Scope scope, String keyPrefix, String ownerAgent) {
        String prefix = PREFIX + scope.wireName() + ":" + (keyPrefix == null ? "" : keyPrefix);
        List<StateEntry> out = new ArrayList<>();
        for (StoredValue row : store.scanPrefix(prefix)) {
            StateEntry entry = parse(row);
            if (ownerAgent == null || ownerAgent.equals(entry.ownerAgent())) {
                out.add(entry);
            }
        }
        return out;
    }

    /**
     * Like {@link #query(Scope, String, String)}, without the entries {@code requestingAgent} may not read.
     */
    public List<StateEntry> query(Scope scope, String keyPrefix, String ownerAgent, String requestingAgent) {
        List<StateEntry> out = new ArrayList<>();
        for (StateEntry entry : query(scope, keyPrefix, ownerAgent)) {
            if (access.canRead(requestingAgent, entry)) {
                out.add(entry);
            }
        }
        return out;
    }

    public List<StateEntry> snapshot(Scope scope) {
        return query(scope, null, null);
    }

    /**
     * Registers a listener for changes under {@code keyPrefix} (empty for the whole scope).
     * Listeners run on the writing thread after the write is durable.
     */
    public ChangeFeed.Subscription subscribe(Scope scope, String keyPrefix, StateChangeListener listener) {
        ListenerRegistration registration = new ListenerRegistration(scope, keyPrefix == null ? "" : keyPrefix, listener);
        listeners.add(registration);
        return () -> listeners.remove(registration);
    }

    /**
     * Applies the operation log of a prepared transaction in one atomic batch.
     */
    public void applyOperations(Transaction transaction, List<TransactionOperation> operations) {
        long nowMs = clock.getAsLong();
        List<BatchWrite> batch = new ArrayList<>();
        List<StateEntry> written = new ArrayList<>();
        List<String[]> deleted = new ArrayList<>();
        List<Scope> cleared = new ArrayList<>();
        for (TransactionOperation op : operations) {
            Scope scope = Scope.fromString(op.scope());
            switch (op.type()) {
                case SET -> {
                    String storeKey = storeKey(scope, op.key());
                    Optional<StateEntry> existing = store.get(storeKey).map(StateStore::parse);
                    long version = existing.map(e -> e.version() + 1).orElse(1L);
                    long createdAt = existing.map(StateEntry::createdAtMs).orElse(nowMs);
                    StateType type = existing.map(StateEntry::stateType).orElse(StateType.CONFIGURATION);
                    AccessLevel level = existing.map(StateEntry::accessLevel).orElse(AccessLevel.PUBLIC);
                    JsonNode value = op.value() == null ? Jsons.mapper().nullNode() : op.value();
                    StateEntry entry = newEntry(op.key(), scope, value, op.agentId(), version, createdAt, nowMs, 0L,
                            ConsistencyLevel.STRONG, type, level);
                    batch.add(BatchWrite.put(storeKey, Jsons.toCompactJson(entry), 0L));
                    written.add(entry);
                }
                case DELETE -> {
                    batch.add(BatchWrite.delete(storeKey(scope, op.key())));
                    deleted.add(new String[]{scope.name(), op.key()});
                }
                case CLEAR_SCOPE -> {
                    batch.add(BatchWrite.deletePrefix(PREFIX + scope.wireName() + ":"));
                    cleared.add(scope);
                }
                case RESTORE_ENTRY -> {
                    StateEntry entry = Jsons.mapper().convertValue(op.value(), StateEntry.class);
                    if (entry.isExpired(nowMs)) {
                        log.debug("skipping lapsed entry on restore key={} scope={}", entry.key(), entry.scope().wireName());
                        continue;
                    }
                    long ttl = entry.expiresAtMs() > 0 ? Math.max(1L, entry.expiresAtMs() - nowMs) : 0L;
                    batch.add(BatchWrite.putVersioned(storeKey(entry.scope(), entry.key()),
                            Jsons.toCompactJson(entry), entry.version(), ttl));
                    written.add(entry);
                }
            }
        }
        store.applyBatch(batch);

        for (Scope scope : cleared) {
            cache.keySet().removeIf(k -> k.startsWith(PREFIX + scope.wireName() + ":"));
        }
        for (String[] removed : deleted) {
            Scope scope = Scope.valueOf(removed[0]);
            cache.remove(storeKey(scope, removed[1]));
            publish(StateChange.DELETED, scope, removed[1], null, transaction.coordinator(), 0L);
            notifyListeners(scope, removed[1], null);
        }
        for (StateEntry entry : written) {
            String storeKey = storeKey(entry.scope(), entry.key());
            cache.remove(storeKey);
            long version = store.get(storeKey).map(StoredValue::version).orElse(entry.version());
            StateEntry durable = entry.withVersion(version);
            publish(StateChange.UPDATED, durable.scope(), durable.key(), durable.stateType(), durable.ownerAgent(), version);
            notifyListeners(durable.scope(), durable.key(), durable);
        }
        log.debug("transaction operations applied txn={} writes={}", transaction.id(), batch.size());
    }

    /**
     * Recomputes checksums of cached entries and compares versions with the store. Mismatches are
     * repaired from the store, or evicted when the store no longer has the entry.
     */
    public ConsistencyReport verifyCacheConsistency() {
        int checked = 0;
        int repaired = 0;
        int evicted = 0;
        for (Map.Entry<String, StateEntry> cached : new ArrayList<>(cache.entrySet())) {
            checked++;
            StateEntry entry = cached.getValue();
            Optional<StoredValue> row = store.get(cached.getKey());
            boolean stale = row.isEmpty() || row.get().version() != entry.version();
            if (entry.checksumMatches() && !stale) {
                continue;
            }
            if (repair(cached.getKey()).isPresent()) {
                repaired++;
            } else {
                evicted++;
            }
        }
        if (repaired + evicted > 0) {
            log.info("cache consistency check checked={} repaired={} evicted={}", checked, repaired, evicted);
        }
        return new ConsistencyReport(checked, repaired, evicted);
    }

    public int cachedEntries() {
        return cache.size();
    }

    /** Test and tooling hook: puts a raw entry into the cache as-is. */
    void cacheForTesting(StateEntry entry) {
        cache.put(storeKey(entry.scope(), entry.key()), entry);
    }

    boolean isCached(Scope scope, String key) {
        return cache.containsKey(storeKey(scope, key));
    }

    @Override
    public void close() {
        invalidation.close();
        cache.clear();
        listeners.clear();
    }

    private Optional<StateEntry> repair(String storeKey) {
        Optional<StoredValue> row = store.get(storeKey);
        if (row.isPresent()) {
            StateEntry fresh = parse(row.get());
            if (fresh.checksumMatches()) {
                cache.put(storeKey, fresh);
                metrics.increment(HubMetrics.CACHE_REPAIRS);
                return Optional.of(fresh);
            }
            log.error("stored entry fails its checksum key={}", storeKey);
        }
        cache.remove(storeKey);
        metrics.increment(HubMetrics.CACHE_EVICTIONS);
        return Optional.empty();
    }

    private Optional<StateEntry> readVerified(String key, Scope scope) {
        Optional<StateEntry> entry = store.get(storeKey(scope, key)).map(StateStore::parse);
        if (entry.isPresent() && !entry.get().checksumMatches()) {
            log.error("stored entry fails its checksum key={} scope={}", key, scope.wireName());
            metrics.increment(HubMetrics.CACHE_EVICTIONS);
            cache.remove(storeKey(scope, key));
            return Optional.empty();
        }
        return entry;
    }

    private long currentVersion(Scope scope, String key) {
        return store.get(storeKey(scope, key)).map(StoredValue::version).orElse(0L);
    }

    private void onRemoteChange(ChangeFeed.FeedMessage message) {
        StateChange change = Jsons.fromJson(message.payload(), StateChange.class);
        String storeKey = storeKey(change.scope(), change.key());
        StateEntry cached = cache.get(storeKey);
        if (cached == null) {
            return;
        }
        if (StateChange.DELETED.equals(change.operation()) || cached.version() < change.version()) {
            cache.remove(storeKey, cached);
        }
    }

    private void publish(String operation, Scope scope, String key, StateType stateType, String owner, long version) {
        StateChange change = new StateChange(operation, key, scope, stateType, owner, version, clock.getAsLong());
        store.publish(StateChange.channel(scope), Jsons.toCompactJson(change));
    }

    private void notifyListeners(Scope scope, String key, StateEntry entry) {
        for (ListenerRegistration registration : listeners) {
            if (registration.scope() != scope || !key.startsWith(registration.keyPrefix())) {
                continue;
            }
            try {
                registration.listener().onChange(scope, key, entry);
            } catch (RuntimeException e) {
                log.warn("state change listener failed key={} scope={}", key, scope.wireName(), e);
            }
        }
    }

    private static StateEntry newEntry(String key, Scope scope, JsonNode value, String owner, long version,
                                       long createdAtMs, long nowMs, long ttlMs, ConsistencyLevel level, StateType stateType,
                                       AccessLevel accessLevel) {
        return new StateEntry(
                key,
                scope,
                value,
                owner,
                version,
                createdAtMs,
                nowMs,
                ttlMs > 0 ? nowMs + ttlMs : 0L,
                level,
                StateEntry.checksumOf(value),
                List.of(),
                stateType == null ? StateType.CONFIGURATION : stateType,
                accessLevel
        );
    }

    private static StateEntry parse(StoredValue row) {
        return Jsons.fromJson(row.value(), StateEntry.class).withVersion(row.version());
    }

    private static void requireKey(String key, Scope scope) {
        if (key == null || key.isBlank() || scope == null) {
            throw new HubException(ErrorKind.VALIDATION, "state key and scope are required");
        }
    }

    private record ListenerRegistration(Scope scope, String keyPrefix, StateChangeListener listener) {
    }
}
