package io.agenthub.txn;

import com.fasterxml.jackson.databind.node.IntNode;
import io.agenthub.config.HubConfig;
import io.agenthub.error.ErrorKind;
import io.agenthub.error.HubException;
import io.agenthub.lock.LockManager;
import io.agenthub.lock.LockType;
import io.agenthub.observability.AuditLogger;
import io.agenthub.observability.HubMetrics;
import io.agenthub.storage.Database;
import io.agenthub.storage.SqliteDurableStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

final class TransactionCoordinatorTest {

    @Test
    void unanimousPrepareAppliesOperationsOnce() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-txn-commit-");
        try {
            Fixture f = new Fixture(root);
            List<String> applied = new CopyOnWriteArrayList<>();
            List<String> notified = new CopyOnWriteArrayList<>();
            TransactionCoordinator txns = f.coordinator((txn, ops) ->
                    ops.forEach(op -> applied.add(op.type() + ":" + op.key())));
            txns.registerParticipant("ledger", new TransactionParticipant() {
                @Override
                public void prepare(Transaction transaction) {
                }

                @Override
                public void committed(Transaction transaction) {
                    notified.add("committed");
                }
            });

            String id = txns.begin("planner", List.of("ledger", "unregistered"), 60_000L);
            Assertions.assertTrue(txns.addOperation(id, OperationType.SET, "global", "budget", IntNode.valueOf(5), "planner"));
            Assertions.assertTrue(txns.addOperation(id, OperationType.DELETE, "global", "draft", null, "planner"));

            CommitOutcome outcome = txns.commit(id);
            Assertions.assertTrue(outcome.committed());
            Assertions.assertEquals(List.of("SET:budget", "DELETE:draft"), applied);
            Assertions.assertEquals(List.of("committed"), notified);
            Assertions.assertEquals(1L, f.metrics.counter(HubMetrics.TRANSACTIONS_COMMITTED));
            Assertions.assertTrue(f.locks.holders("global", "budget").isEmpty());

            CommitOutcome again = txns.commit(id);
            Assertions.assertEquals(TransactionStatus.COMMITTED, again.status());
            Assertions.assertEquals(2, applied.size());
            Assertions.assertEquals(TransactionStatus.COMMITTED, txns.rollback(id).status());
            Assertions.assertFalse(txns.addOperation(id, OperationType.SET, "global", "late", IntNode.valueOf(1), "planner"));
            Assertions.assertTrue(f.audit.verifyIntegrity().valid());
            f.store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void participantAbortVoteSkipsTheApplier() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-txn-vote-");
        try {
            Fixture f = new Fixture(root);
            List<String> applied = new CopyOnWriteArrayList<>();
            TransactionCoordinator txns = f.coordinator((txn, ops) -> applied.add(txn.id()));
            txns.registerParticipant("risk", transaction -> {
                throw new IllegalStateException("exposure limit");
            });

            String id = txns.begin("planner", List.of("risk"), 60_000L);
            txns.addOperation(id, OperationType.SET, "global", "budget", IntNode.valueOf(9), "planner");
            CommitOutcome outcome = txns.commit(id);

            Assertions.assertFalse(outcome.committed());
            Assertions.assertEquals(TransactionStatus.ABORTED, outcome.status());
            Assertions.assertEquals("prepare failed: participant risk voted abort", outcome.reason());
            Assertions.assertTrue(applied.isEmpty());
            Assertions.assertEquals(Boolean.FALSE, txns.find(id).orElseThrow().votes().get("risk"));
            Assertions.assertTrue(f.locks.holders("global", "budget").isEmpty());
            f.store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lockedKeyAbortsPrepare() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-txn-locked-");
        try {
            Fixture f = new Fixture(root);
            TransactionCoordinator txns = f.coordinator((txn, ops) -> Assertions.fail("must not apply"));
            Assertions.assertTrue(f.locks.acquire("global", "budget", LockType.EXCLUSIVE, "someone", 60_000L).granted());

            String id = txns.begin("planner", List.of(), 60_000L);
            txns.addOperation(id, OperationType.SET, "global", "budget", IntNode.valueOf(1), "planner");
            CommitOutcome outcome = txns.commit(id);

            Assertions.assertEquals(TransactionStatus.ABORTED, outcome.status());
            Assertions.assertTrue(outcome.reason().startsWith("prepare failed: lock:global:budget"));
            Assertions.assertEquals(1L, f.metrics.counter(HubMetrics.TRANSACTIONS_ABORTED));
            f.store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rollbackAndTimeoutAbortPendingTransactions() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-txn-timeout-");
        try {
            Fixture f = new Fixture(root);
            TransactionCoordinator txns = f.coordinator((txn, ops) -> { });

            String rolledBack = txns.begin("planner", List.of(), 60_000L);
            Assertions.assertEquals("rolled back", txns.rollback(rolledBack).reason());
            Assertions.assertEquals(TransactionStatus.ABORTED, txns.rollback(rolledBack).status());

            String slow = txns.begin("planner", List.of(), 1_000L);
            Assertions.assertEquals(1, txns.pending().size());
            f.now.addAndGet(1_001L);
            Assertions.assertEquals(1, txns.abortExpired());
            Transaction timedOut = txns.find(slow).orElseThrow();
            Assertions.assertEquals(TransactionStatus.ABORTED, timedOut.status());
            Assertions.assertEquals("timeout", timedOut.reason());
            Assertions.assertTrue(txns.pending().isEmpty());
            f.store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void beginValidatesArguments() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-txn-validate-");
        try {
            Fixture f = new Fixture(root);
            TransactionCoordinator txns = f.coordinator((txn, ops) -> { });
            HubException blank = Assertions.assertThrows(HubException.class, () -> txns.begin(" ", List.of(), 1_000L));
            Assertions.assertEquals(ErrorKind.VALIDATION, blank.kind());
            Assertions.assertThrows(HubException.class, () -> txns.begin("planner", List.of(), 0L));
            Assertions.assertThrows(HubException.class, () -> txns.commit("missing"));
            f.store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    private static final class Fixture {
        private final AtomicLong now = new AtomicLong(1_000_000L);
        private final SqliteDurableStore store;
        private final HubMetrics metrics = new HubMetrics();
        private final LockManager locks;
        private final AuditLogger audit;

        private Fixture(Path root) {
            HubConfig config = HubConfig.fromRoot(root.toString());
            Database db = new Database(config);
            db.init();
            this.store = new SqliteDurableStore(db, now::get);
            this.locks = new LockManager(store, metrics, now::get);
            this.audit = new AuditLogger(config.auditFile());
        }

        private TransactionCoordinator coordinator(TransactionApplier applier) {
            return new TransactionCoordinator(store, locks, applier, audit, metrics, 30_000L, now::get);
        }
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
