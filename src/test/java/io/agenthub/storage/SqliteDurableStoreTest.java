package io.agenthub.storage;

import io.agenthub.config.HubConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

final class SqliteDurableStoreTest {

    @Test
    void versionsGrowByOneAndConditionalWritesFence() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-store-");
        try {
            AtomicLong now = new AtomicLong(1_000L);
            SqliteDurableStore store = open(root, now);

            Assertions.assertTrue(store.setIfAbsent("k", "v1", 0L));
            Assertions.assertFalse(store.setIfAbsent("k", "other", 0L));
            Assertions.assertEquals(1L, store.get("k").orElseThrow().version());

            Assertions.assertTrue(store.compareAndSet("k", 1L, "v2", 0L));
            Assertions.assertFalse(store.compareAndSet("k", 1L, "stale", 0L));
            StoredValue row = store.get("k").orElseThrow();
            Assertions.assertEquals("v2", row.value());
            Assertions.assertEquals(2L, row.version());

            Assertions.assertEquals(3L, store.put("k", "v3", 0L).version());
            Assertions.assertFalse(store.deleteIfVersion("k", 2L));
            Assertions.assertTrue(store.deleteIfVersion("k", 3L));
            Assertions.assertTrue(store.get("k").isEmpty());
            store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void expiredRowsReadAbsentAndCanBeReclaimed() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-store-ttl-");
        try {
            AtomicLong now = new AtomicLong(1_000L);
            SqliteDurableStore store = open(root, now);

            Assertions.assertTrue(store.setIfAbsent("lease", "owner-a", 500L));
            now.addAndGet(499L);
            Assertions.assertFalse(store.setIfAbsent("lease", "owner-b", 500L));
            now.addAndGet(1L);
            Assertions.assertTrue(store.get("lease").isEmpty());
            Assertions.assertTrue(store.setIfAbsent("lease", "owner-b", 500L));
            Assertions.assertEquals("owner-b", store.get("lease").orElseThrow().value());

            store.put("temp", "x", 10L);
            now.addAndGet(1_000L);
            Assertions.assertEquals(2, store.purgeExpired(now.get()));
            store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void scanPrefixIsOrderedAndSkipsOtherPrefixes() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-store-scan-");
        try {
            SqliteDurableStore store = open(root, new AtomicLong(1L));
            store.put("state:global:b", "2", 0L);
            store.put("state:global:a", "1", 0L);
            store.put("state:agent:a", "3", 0L);

            List<StoredValue> rows = store.scanPrefix("state:global:");
            Assertions.assertEquals(List.of("state:global:a", "state:global:b"),
                    rows.stream().map(StoredValue::key).toList());
            store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedBatchLeavesNothingBehind() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-store-batch-");
        try {
            SqliteDurableStore store = open(root, new AtomicLong(1L));
            store.put("keep", "old", 0L);

            Assertions.assertThrows(IllegalArgumentException.class, () -> store.applyBatch(List.of(
                    BatchWrite.put("keep", "new", 0L),
                    BatchWrite.put("fresh", "x", 0L),
                    BatchWrite.putVersioned("bad", "x", 0L, 0L)
            )));
            Assertions.assertEquals("old", store.get("keep").orElseThrow().value());
            Assertions.assertTrue(store.get("fresh").isEmpty());

            store.applyBatch(List.of(
                    BatchWrite.putVersioned("restored", "x", 7L, 0L),
                    BatchWrite.deletePrefix("kee")
            ));
            Assertions.assertEquals(7L, store.get("restored").orElseThrow().version());
            Assertions.assertTrue(store.get("keep").isEmpty());
            store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void subscribersReceiveMatchingChannels() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-store-feed-");
        try {
            SqliteDurableStore store = open(root, new AtomicLong(1L));
            List<String> seen = new CopyOnWriteArrayList<>();
            store.subscribe("state_changes:*", message -> seen.add(message.channel() + "=" + message.payload()));
            store.publish("state_changes:global", "a");
            store.publish("other", "b");
            store.feed().drain(2_000L);

            Assertions.assertEquals(List.of("state_changes:global=a"), seen);
            store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    private static SqliteDurableStore open(Path root, AtomicLong now) {
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
