package io.agenthub.runtime;

import io.agenthub.agent.AgentRegistry;
import io.agenthub.agent.AgentRouter;
import io.agenthub.bus.MessageBus;
import io.agenthub.bus.workflow.WorkflowEngine;
import io.agenthub.config.HubConfig;
import io.agenthub.config.HubSettings;
import io.agenthub.conflict.ConflictArbiter;
import io.agenthub.conflict.ConflictResolver;
import io.agenthub.conflict.HumanEscalations;
import io.agenthub.conflict.PriorityModel;
import io.agenthub.lock.LockManager;
import io.agenthub.model.Priority;
import io.agenthub.observability.AuditLogger;
import io.agenthub.observability.HubMetrics;
import io.agenthub.observability.PrometheusFormatter;
import io.agenthub.state.CheckpointService;
import io.agenthub.state.ConsistencyReport;
import io.agenthub.state.StateStore;
import io.agenthub.storage.Database;
import io.agenthub.storage.SqliteDurableStore;
import io.agenthub.txn.TransactionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

public final class AgentHubRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AgentHubRuntime.class);
    private static final long MAX_STATE_LOCK_WAIT_MS = 5_000L;

    private final HubConfig config;
    private final HubSettings settings;
    private final LongSupplier clock;
    private final Database database;
    private final SqliteDurableStore store;
    private final AuditLogger auditLogger;
    private final HubMetrics metrics;
    private final PriorityModel priorities;
    private final HumanEscalations escalations;
    private final ConflictArbiter arbiter;
    private final LockManager locks;
    private final StateStore state;
    private final TransactionCoordinator transactions;
    private final CheckpointService checkpoints;
    private final MessageBus bus;
    private final WorkflowEngine workflows;
    private final AgentRegistry registry;
    private final AgentRouter router;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private ScheduledExecutorService sweeper;

    public AgentHubRuntime(HubConfig config) {
        this(config, System::currentTimeMillis);
    }

    public AgentHubRuntime(HubConfig config, LongSupplier clock) {
        this.config = config;
        this.settings = config.settings();
        this.clock = clock;
        this.database = new Database(config);
        this.database.init();
        this.store = new SqliteDurableStore(database, clock);
        this.auditLogger = new AuditLogger(config.auditFile(),
                loadOrCreateAuditSigningSecret(config.securityRoot().resolve("audit-signing.key")));
        this.metrics = new HubMetrics();
        this.priorities = PriorityModel.fromSettings(settings);
        this.escalations = new HumanEscalations(store, auditLogger, metrics, clock);
        this.arbiter = new ConflictArbiter(priorities, escalations, auditLogger, metrics);
        this.locks = new LockManager(store, metrics, clock);
        this.state = new StateStore(store, locks, new ConflictResolver(priorities, escalations), metrics,
                settings.lockLeaseMs(), Math.min(settings.lockLeaseMs(), MAX_STATE_LOCK_WAIT_MS), clock);
        this.transactions = new TransactionCoordinator(store, locks, state::applyOperations, auditLogger, metrics,
                settings.lockLeaseMs(), clock);
        this.checkpoints = new CheckpointService(state, transactions, store, auditLogger, clock);
        this.bus = new MessageBus(settings, store, auditLogger, metrics, clock);
        this.workflows = new WorkflowEngine(settings, bus, state, priorities, escalations, metrics, clock);
        this.registry = new AgentRegistry(bus, store, auditLogger, metrics, settings.heartbeatTimeoutMs(), clock);
        this.router = new AgentRouter(settings, registry, bus, arbiter, auditLogger, metrics, clock);
    }

    /**
     * Starts the bus workers and the periodic sweeps. Idempotent.
     */
    public void start() {
        if (closed.get() || !started.compareAndSet(false, true)) {
            return;
        }
        bus.start();
        AtomicInteger counter = new AtomicInteger();
        sweeper = Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "agenthub-sweep-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        schedule("lock-expiry", settings.lockSweepIntervalMs(), locks::reclaimExpired);
        schedule("transaction-timeout", settings.transactionSweepIntervalMs(), transactions::abortExpired);
        schedule("workflow-health", settings.workflowMonitorIntervalMs(), () -> {
            workflows.detectStuck();
            workflows.expireWorkflows();
        });
        schedule("cache-consistency", settings.consistencyCheckIntervalMs(), state::verifyCacheConsistency);
        schedule("session-cleanup", settings.sessionSweepIntervalMs(), () -> {
            router.sweepSessions();
            store.purgeExpired(clock.getAsLong());
        });
        schedule("agent-health", settings.agentHealthIntervalMs(), registry::sweepHeartbeats);
        log.info("agent hub started root={}", config.rootDir());
    }

    /** Runs every sweep once, synchronously. */
    public MaintenanceOutcome runMaintenance() {
        long nowMs = clock.getAsLong();
        int locksReclaimed = locks.reclaimExpired(nowMs);
        int transactionsAborted = transactions.abortExpired(nowMs);
        List<String> stuck = workflows.detectStuck(nowMs);
        int workflowsExpired = workflows.expireWorkflows(nowMs);
        ConsistencyReport cache = state.verifyCacheConsistency();
        int sessionsExpired = router.sweepSessions(nowMs);
        List<String> agentsTimedOut = registry.sweepHeartbeats(nowMs);
        int rowsPurged = store.purgeExpired(nowMs);
        int deadLettersFlushed = bus.drainDeadLetters();
        MaintenanceOutcome outcome = new MaintenanceOutcome(
                locksReclaimed,
                transactionsAborted,
                stuck,
                workflowsExpired,
                cache.repaired(),
                cache.evicted(),
                sessionsExpired,
                agentsTimedOut,
                rowsPurged,
                deadLettersFlushed
        );
        auditLogger.log(AuditLogger.AuditEvent.of("runtime.maintenance", "maintenance", "runtime/maintenance", "ok",
                Map.of("locks_reclaimed", locksReclaimed, "transactions_aborted", transactionsAborted,
                        "workflows_stuck", stuck.size(), "rows_purged", rowsPurged)));
        return outcome;
    }

    public String metricsText() {
        for (Priority priority : List.of(Priority.HIGH, Priority.MEDIUM, Priority.LOW)) {
            metrics.setGauge(HubMetrics.QUEUE_DEPTH, priority.wireName(), bus.queues().size(priority));
        }
        return PrometheusFormatter.format(metrics.snapshot());
    }

    public AuditLogger.IntegrityReport verifyAuditIntegrity() {
        return auditLogger.verifyIntegrity();
    }

    public HubConfig config() {
        return config;
    }

    public HubSettings settings() {
        return settings;
    }

    public Database database() {
        return database;
    }

    public SqliteDurableStore store() {
        return store;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public HubMetrics metrics() {
        return metrics;
    }

    public PriorityModel priorities() {
        return priorities;
    }

    public HumanEscalations escalations() {
        return escalations;
    }

    public LockManager locks() {
        return locks;
    }

    public StateStore state() {
        return state;
    }

    public TransactionCoordinator transactions() {
        return transactions;
    }

    public CheckpointService checkpoints() {
        return checkpoints;
    }

    public MessageBus bus() {
        return bus;
    }

    public WorkflowEngine workflows() {
        return workflows;
    }

    public AgentRegistry registry() {
        return registry;
    }

    public AgentRouter router() {
        return router;
    }

    /**
     * Stops accepting work, lets in-flight deliveries and workflow steps finish, then stops the
     * sweeps and releases the store.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        bus.close();
        workflows.close();
        if (sweeper != null) {
            sweeper.shutdown();
            try {
                if (!sweeper.awaitTermination(5, TimeUnit.SECONDS)) {
                    sweeper.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sweeper.shutdownNow();
            }
        }
        state.close();
        store.close();
        log.info("agent hub stopped");
    }

    private void schedule(String name, long intervalMs, Runnable sweep) {
        sweeper.scheduleWithFixedDelay(() -> {
            try {
                sweep.run();
            } catch (RuntimeException e) {
                log.error("{} sweep failed", name, e);
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private static String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    public record MaintenanceOutcome(
            int locksReclaimed,
            int transactionsAborted,
            List<String> stuckWorkflows,
            int workflowsExpired,
            int cacheRepaired,
            int cacheEvicted,
            int sessionsExpired,
            List<String> agentsTimedOut,
            int expiredRowsPurged,
            int deadLettersFlushed
    ) {
    }
}
