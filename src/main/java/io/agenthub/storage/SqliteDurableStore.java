package io.agenthub.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * {@link DurableStore} over the {@code kv_entries} table.
 * <p>
 * Writers are serialized in-process so concurrent callers never trip over SQLite's single-writer
 * lock; the conditional statements themselves still carry the atomicity.
 */
public final class SqliteDurableStore implements DurableStore {
    private final Database database;
    private final LongSupplier clock;
    private final ChangeFeed feed;
    private final ReentrantLock writeLock = new ReentrantLock();

    public SqliteDurableStore(Database database) {
        this(database, System::currentTimeMillis);
    }

    public SqliteDurableStore(Database database, LongSupplier clock) {
        this.database = database;
        this.clock = clock;
        this.feed = new ChangeFeed();
    }

    public ChangeFeed feed() {
        return feed;
    }

    @Override
    public Optional<StoredValue> get(String key) {
        long nowMs = clock.getAsLong();
        String sql = """
                SELECT entry_key,entry_value,version,updated_at_ms,expires_at_ms
                FROM kv_entries
                WHERE entry_key=? AND (expires_at_ms=0 OR expires_at_ms>?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setLong(2, nowMs);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(readRow(rs));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to read key: " + key, e);
        }
    }

    @Override
    public StoredValue put(String key, String value, long ttlMs) {
        long nowMs = clock.getAsLong();
        long expiresAt = expiresAt(nowMs, ttlMs);
        writeLock.lock();
        try (Connection c = database.openConnection()) {
            upsertBump(c, key, value, nowMs, expiresAt);
            return readLive(c, key, nowMs).orElseThrow(
                    () -> new IllegalStateException("Row vanished after write: " + key));
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to write key: " + key, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean setIfAbsent(String key, String value, long ttlMs) {
        long nowMs = clock.getAsLong();
        // The update branch fires only when the existing row has expired.
        String sql = """
                INSERT INTO kv_entries(entry_key,entry_value,version,updated_at_ms,expires_at_ms)
                VALUES(?,?,1,?,?)
                ON CONFLICT(entry_key) DO UPDATE SET
                    entry_value=excluded.entry_value,
                    version=kv_entries.version+1,
                    updated_at_ms=excluded.updated_at_ms,
                    expires_at_ms=excluded.expires_at_ms
                WHERE kv_entries.expires_at_ms>0 AND kv_entries.expires_at_ms<=?
                """;
        writeLock.lock();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.setLong(3, nowMs);
            ps.setLong(4, expiresAt(nowMs, ttlMs));
            ps.setLong(5, nowMs);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to set-if-absent key: " + key, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean compareAndSet(String key, long expectedVersion, String value, long ttlMs) {
        long nowMs = clock.getAsLong();
        String sql = """
                UPDATE kv_entries
                SET entry_value=?, version=version+1, updated_at_ms=?, expires_at_ms=?
                WHERE entry_key=? AND version=? AND (expires_at_ms=0 OR expires_at_ms>?)
                """;
        writeLock.lock();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, value);
            ps.setLong(2, nowMs);
            ps.setLong(3, expiresAt(nowMs, ttlMs));
            ps.setString(4, key);
            ps.setLong(5, expectedVersion);
            ps.setLong(6, nowMs);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to compare-and-set key: " + key, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        long nowMs = clock.getAsLong();
        writeLock.lock();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "DELETE FROM kv_entries WHERE entry_key=? AND (expires_at_ms=0 OR expires_at_ms>?)")) {
            ps.setString(1, key);
            ps.setLong(2, nowMs);
            int removed = ps.executeUpdate();
            if (removed == 0) {
                purgeKey(c, key);
            }
            return removed > 0;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to delete key: " + key, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean deleteIfVersion(String key, long expectedVersion) {
        writeLock.lock();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM kv_entries WHERE entry_key=? AND version=?")) {
            ps.setString(1, key);
            ps.setLong(2, expectedVersion);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to delete key: " + key, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<StoredValue> scanPrefix(String prefix) {
        return scan(prefix, false);
    }

    @Override
    public List<StoredValue> scanPrefixIncludingExpired(String prefix) {
        return scan(prefix, true);
    }

    private List<StoredValue> scan(String prefix, boolean includeExpired) {
        long nowMs = clock.getAsLong();
        String sql = """
                SELECT entry_key,entry_value,version,updated_at_ms,expires_at_ms
                FROM kv_entries
                WHERE substr(entry_key,1,?)=? AND (?=1 OR expires_at_ms=0 OR expires_at_ms>?)
                ORDER BY entry_key
                """;
        List<StoredValue> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, prefix.length());
            ps.setString(2, prefix);
            ps.setInt(3, includeExpired ? 1 : 0);
            ps.setLong(4, nowMs);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readRow(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to scan prefix: " + prefix, e);
        }
    }

    @Override
    public void applyBatch(List<BatchWrite> writes) {
        if (writes == null || writes.isEmpty()) {
            return;
        }
        long nowMs = clock.getAsLong();
        writeLock.lock();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                for (BatchWrite write : writes) {
                    applyOne(c, write, nowMs);
                }
                c.commit();
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to apply batch of " + writes.size() + " writes", e);
        } finally {
            writeLock.unlock();
        }
    }

    private void applyOne(Connection c, BatchWrite write, long nowMs) throws SQLException {
        switch (write.kind()) {
            case PUT -> upsertBump(c, write.key(), write.value(), nowMs, expiresAt(nowMs, write.ttlMs()));
            case PUT_VERSIONED -> {
                if (write.version() < 1) {
                    throw new IllegalArgumentException("version must be positive for " + write.key());
                }
                try (PreparedStatement ps = c.prepareStatement("""
                        INSERT OR REPLACE INTO kv_entries(entry_key,entry_value,version,updated_at_ms,expires_at_ms)
                        VALUES(?,?,?,?,?)
                        """)) {
                    ps.setString(1, write.key());
                    ps.setString(2, write.value());
                    ps.setLong(3, write.version());
                    ps.setLong(4, nowMs);
                    ps.setLong(5, expiresAt(nowMs, write.ttlMs()));
                    ps.executeUpdate();
                }
            }
            case DELETE -> purgeKey(c, write.key());
            case DELETE_PREFIX -> {
                try (PreparedStatement ps = c.prepareStatement(
                        "DELETE FROM kv_entries WHERE substr(entry_key,1,?)=?")) {
                    ps.setInt(1, write.key().length());
                    ps.setString(2, write.key());
                    ps.executeUpdate();
                }
            }
        }
    }

    @Override
    public int purgeExpired(long nowMs) {
        writeLock.lock();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "DELETE FROM kv_entries WHERE expires_at_ms>0 AND expires_at_ms<=?")) {
            ps.setLong(1, nowMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to purge expired entries", e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void publish(String channel, String message) {
        feed.publish(channel, message);
    }

    @Override
    public ChangeFeed.Subscription subscribe(String pattern, Consumer<ChangeFeed.FeedMessage> listener) {
        return feed.subscribe(pattern, listener);
    }

    @Override
    public void close() {
        feed.close();
    }

    private void upsertBump(Connection c, String key, String value, long nowMs, long expiresAt) throws SQLException {
        // An expired row is replaced but keeps counting versions from where it stopped.
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO kv_entries(entry_key,entry_value,version,updated_at_ms,expires_at_ms)
                VALUES(?,?,1,?,?)
                ON CONFLICT(entry_key) DO UPDATE SET
                    entry_value=excluded.entry_value,
                    version=kv_entries.version+1,
                    updated_at_ms=excluded.updated_at_ms,
                    expires_at_ms=excluded.expires_at_ms
                """)) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.setLong(3, nowMs);
            ps.setLong(4, expiresAt);
            ps.executeUpdate();
        }
    }

    private void purgeKey(Connection c, String key) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM kv_entries WHERE entry_key=?")) {
            ps.setString(1, key);
            ps.executeUpdate();
        }
    }

    private Optional<StoredValue> readLive(Connection c, String key, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT entry_key,entry_value,version,updated_at_ms,expires_at_ms
                FROM kv_entries
                WHERE entry_key=? AND (expires_at_ms=0 OR expires_at_ms>?)
                """)) {
            ps.setString(1, key);
            ps.setLong(2, nowMs);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readRow(rs)) : Optional.empty();
            }
        }
    }

    private static StoredValue readRow(ResultSet rs) throws SQLException {
        return new StoredValue(
                rs.getString("entry_key"),
                rs.getString("entry_value"),
                rs.getLong("version"),
                rs.getLong("updated_at_ms"),
                rs.getLong("expires_at_ms")
        );
    }

    private static long expiresAt(long nowMs, long ttlMs) {
        return ttlMs > 0 ? nowMs + ttlMs : 0L;
    }
}
