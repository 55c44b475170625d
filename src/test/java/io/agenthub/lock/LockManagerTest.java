package io.agenthub.lock;

import io.agenthub.config.HubConfig;
import io.agenthub.observability.HubMetrics;
import io.agenthub.storage.Database;
import io.agenthub.storage.SqliteDurableStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

final class LockManagerTest {

    @Test
    void exclusiveLockExcludesEveryOtherOwner() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-lock-exclusive-");
        try {
            AtomicLong now = new AtomicLong(10_000L);
            SqliteDurableStore store = openStore(root, now);
            HubMetrics metrics = new HubMetrics();
            LockManager locks = new LockManager(store, metrics, now::get);

            LockOutcome first = locks.acquire("global", "budget", LockType.EXCLUSIVE, "agent-a", 1_000L);
            Assertions.assertTrue(first.granted());
            Assertions.assertEquals("lock:global:budget", first.lockKey());
            Assertions.assertEquals(11_000L, first.expiresAtMs());

            LockOutcome blocked = locks.acquire("global", "budget", LockType.SHARED, "agent-b", 1_000L);
            Assertions.assertFalse(blocked.granted());
            Assertions.assertEquals("agent-a", blocked.blockingOwner());
            Assertions.assertEquals(1L, metrics.counter(HubMetrics.LOCKS_DENIED));

            Assertions.assertFalse(locks.release("global", "budget", "agent-b"));
            Assertions.assertTrue(locks.release("global", "budget", "agent-a"));
            Assertions.assertTrue(locks.acquire("global", "budget", LockType.EXCLUSIVE, "agent-b", 1_000L).granted());
            store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sharedHoldersCoexistButBlockWriters() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-lock-shared-");
        try {
            AtomicLong now = new AtomicLong(10_000L);
            SqliteDurableStore store = openStore(root, now);
            LockManager locks = new LockManager(store, new HubMetrics(), now::get);

            Assertions.assertTrue(locks.acquire("agent", "profile", LockType.SHARED, "reader-1", 5_000L).granted());
            Assertions.assertTrue(locks.acquire("agent", "profile", LockType.SHARED, "reader-2", 5_000L).granted());
            Assertions.assertTrue(locks.acquire("agent", "profile", LockType.INTENT, "planner", 5_000L).granted());
            Assertions.assertFalse(locks.acquire("agent", "profile", LockType.EXCLUSIVE, "writer", 5_000L).granted());
            Assertions.assertFalse(locks.acquire("agent", "profile", LockType.INTENT, "planner-2", 5_000L).granted());
            Assertions.assertEquals(3, locks.holders("agent", "profile").size());

            Assertions.assertEquals(1, locks.releaseAll("reader-1"));
            Assertions.assertEquals(2, locks.holders("agent", "profile").size());
            store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void expiredLeasesAreReclaimedAndRenewExtendsThem() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-lock-expiry-");
        try {
            AtomicLong now = new AtomicLong(10_000L);
            SqliteDurableStore store = openStore(root, now);
            HubMetrics metrics = new HubMetrics();
            LockManager locks = new LockManager(store, metrics, now::get);

            Assertions.assertTrue(locks.acquire("global", "a", LockType.SHARED, "short", 100L).granted());
            Assertions.assertTrue(locks.acquire("global", "a", LockType.SHARED, "long", 10_000L).granted());
            now.addAndGet(500L);
            Assertions.assertEquals(1, locks.reclaimExpired());
            Assertions.assertEquals(1L, metrics.counter(HubMetrics.LOCKS_RECLAIMED));
            Assertions.assertEquals(List.of("long"),
                    locks.holders("global", "a").stream().map(LockHolder::owner).toList());

            LockOutcome renewed = locks.renew("global", "a", "long", 10_000L);
            Assertions.assertTrue(renewed.granted());
            Assertions.assertEquals(20_500L, renewed.expiresAtMs());
            Assertions.assertFalse(locks.renew("global", "a", "short", 1_000L).granted());

            now.addAndGet(20_000L);
            Assertions.assertTrue(locks.acquire("global", "a", LockType.EXCLUSIVE, "next", 1_000L).granted());
            store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rejectsNonPositiveDurationAndBlankOwner() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-lock-validation-");
        try {
            SqliteDurableStore store = openStore(root, new AtomicLong(1L));
            LockManager locks = new LockManager(store, new HubMetrics());
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> locks.acquire("global", "k", LockType.EXCLUSIVE, "owner", 0L));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> locks.acquire("global", "k", LockType.EXCLUSIVE, " ", 1_000L));
            store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentExclusiveAcquireGrantsExactlyOne() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-lock-race-");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            SqliteDurableStore store = openStore(root, new AtomicLong(10_000L));
            LockManager locks = new LockManager(store, new HubMetrics(), () -> 10_000L);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String owner = "agent-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    return locks.acquire("global", "hot", LockType.EXCLUSIVE, owner, 60_000L).granted();
                }));
            }
            start.countDown();
            int granted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    granted++;
                }
            }
            Assertions.assertEquals(1, granted);
            Assertions.assertEquals(1, locks.holders("global", "hot").size());
            store.close();
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void sweepReclaimsALockWhoseOnlyHolderLapsed() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-lock-lapsed-");
        try {
            AtomicLong now = new AtomicLong(10_000L);
            SqliteDurableStore store = openStore(root, now);
            HubMetrics metrics = new HubMetrics();
            LockManager locks = new LockManager(store, metrics, now::get);

            Assertions.assertTrue(locks.acquire("global", "treasury", LockType.EXCLUSIVE, "crashed", 100L).granted());
            Assertions.assertEquals(1, locks.trackedOwners());
            now.addAndGet(500L);

            Assertions.assertEquals(1, locks.reclaimExpired());
            Assertions.assertEquals(1L, metrics.counter(HubMetrics.LOCKS_RECLAIMED));
            Assertions.assertEquals(0, locks.trackedOwners());
            Assertions.assertTrue(store.scanPrefixIncludingExpired("lock:").isEmpty());
            Assertions.assertEquals(0, locks.reclaimExpired());
            store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void ownerIndexDropsOwnersOnceTheirLocksAreGone() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-lock-index-");
        try {
            AtomicLong now = new AtomicLong(10_000L);
            SqliteDurableStore store = openStore(root, now);
            LockManager locks = new LockManager(store, new HubMetrics(), now::get);

            for (int i = 0; i < 50; i++) {
                String reader = "reader:" + i;
                Assertions.assertTrue(locks.acquire("global", "prices", LockType.EXCLUSIVE, reader, 1_000L).granted());
                Assertions.assertTrue(locks.release("global", "prices", reader));
            }
            Assertions.assertEquals(0, locks.trackedOwners());

            Assertions.assertTrue(locks.acquire("global", "prices", LockType.SHARED, "stale", 100L).granted());
            now.addAndGet(200L);
            Assertions.assertTrue(locks.acquire("global", "prices", LockType.SHARED, "fresh", 10_000L).granted());
            Assertions.assertEquals(1, locks.trackedOwners());
            Assertions.assertEquals(1, locks.releaseAll("fresh"));
            Assertions.assertEquals(0, locks.trackedOwners());
            store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    private static SqliteDurableStore openStore(Path root, AtomicLong now) {
        Database db = new Database(HubConfig.fromRoot(root.toString()));
        db.init();
        return new SqliteDurableStore(db, now::get);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
