package io.agenthub.bus.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agenthub.bus.MessageBus;
import io.agenthub.bus.SendOutcome;
import io.agenthub.config.HubSettings;
import io.agenthub.conflict.ConflictStrategy;
import io.agenthub.conflict.EscalationKind;
import io.agenthub.conflict.HumanEscalations;
import io.agenthub.conflict.PriorityModel;
import io.agenthub.model.Message;
import io.agenthub.model.Priority;
import io.agenthub.observability.HubMetrics;
import io.agenthub.state.ConsistencyLevel;
import io.agenthub.state.Scope;
import io.agenthub.state.StateEntry;
import io.agenthub.state.StateStore;
import io.agenthub.state.StateType;
import io.agenthub.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Drives workflows over the message bus. Each step is a request to one participant; the reply
 * payload becomes that participant's result. Workflows run on a worker pool, so
 * {@link #startWorkflow} only validates and schedules.
 *
 * <p>Context keys understood by the engine: {@code action} (step action, default
 * {@code workflow_step}) and {@code max_rounds} (iterative round budget). An iterative workflow
 * ends early when a reply payload carries {@code "done": true}.
 */
public final class WorkflowEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);
    public static final String ENGINE_AGENT = "workflow_engine";
    public static final String DEFAULT_ACTION = "workflow_step";
    public static final String RECOVERY_ACTION = "workflow_recovery";

    private final MessageBus bus;
    private final StateStore state;
    private final PriorityModel priorities;
    private final HumanEscalations escalations;
    private final HubMetrics metrics;
    private final LongSupplier clock;
    private final long stepTimeoutMs;
    private final long workflowTtlMs;
    private final long stuckAfterMs;
    private final int defaultRounds;
    private final String orchestratorAgentId;
    private final Map<String, WorkflowState> workflows = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<WorkflowState>> completions = new ConcurrentHashMap<>();
    private final ExecutorService workers;

    public WorkflowEngine(
            HubSettings settings,
            MessageBus bus,
            StateStore state,
            PriorityModel priorities,
            HumanEscalations escalations,
            HubMetrics metrics,
            LongSupplier clock
    ) {
        this.bus = bus;
        this.state = state;
        this.priorities = priorities;
        this.escalations = escalations;
        this.metrics = metrics;
        this.clock = clock;
        this.stepTimeoutMs = settings.coordinationWaitMs();
        this.workflowTtlMs = settings.workflowTtlMs();
        this.stuckAfterMs = settings.stuckWorkflowMs();
        this.defaultRounds = settings.iterativeMaxRounds();
        this.orchestratorAgentId = settings.orchestratorAgentId();
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "agenthub-workflow-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public WorkflowOutcome startWorkflow(String workflowId, WorkflowPattern pattern, List<String> agents,
                                         Map<String, Object> context) {
        if (workflowId == null || workflowId.isBlank()) {
            return WorkflowOutcome.error(workflowId, "workflow id is required");
        }
        if (pattern == null) {
            return WorkflowOutcome.error(workflowId, "workflow pattern is required");
        }
        if (agents == null || agents.isEmpty()) {
            return WorkflowOutcome.error(workflowId, "at least one participant is required");
        }
        for (String agent : agents) {
            if (!bus.hasHandler(agent)) {
                return WorkflowOutcome.error(workflowId, "no handler registered for " + agent);
            }
        }
        Map<String, Object> ctx = context == null ? Map.of() : context;
        List<String> participants = pattern == WorkflowPattern.ESCALATION ? escalationOrder(agents) : List.copyOf(agents);
        int rounds = roundBudget(ctx);
        int totalSteps = switch (pattern) {
            case SEQUENTIAL, ESCALATION -> participants.size();
            case PARALLEL -> 1;
            case ITERATIVE -> rounds * participants.size();
        };
        WorkflowState initial = WorkflowState.started(workflowId, pattern, participants, totalSteps, ctx, clock.getAsLong());
        if (workflows.putIfAbsent(workflowId, initial) != null) {
            return WorkflowOutcome.error(workflowId, "workflow already exists");
        }
        completions.put(workflowId, new CompletableFuture<>());
        save(initial);
        metrics.increment(HubMetrics.WORKFLOWS_STARTED);
        log.info("workflow started id={} pattern={} participants={}", workflowId, pattern.wireName(), participants);
        workers.submit(() -> run(initial, rounds));
        return WorkflowOutcome.ok(workflowId);
    }

    /** Completes once the workflow reaches a terminal status. */
    public CompletableFuture<WorkflowState> completion(String workflowId) {
        CompletableFuture<WorkflowState> future = completions.get(workflowId);
        if (future != null) {
            return future;
        }
        return find(workflowId)
                .filter(found -> found.status().isTerminal())
                .map(CompletableFuture::completedFuture)
                .orElseGet(() -> CompletableFuture.failedFuture(
                        new IllegalArgumentException("unknown workflow: " + workflowId)));
    }

    public Optional<WorkflowState> find(String workflowId) {
        WorkflowState live = workflows.get(workflowId);
        if (live != null) {
            return Optional.of(live);
        }
        return state.getEntry(workflowId, Scope.WORKFLOW, ConsistencyLevel.EVENTUAL).map(WorkflowEngine::parse);
    }

    public List<WorkflowState> active() {
        List<WorkflowState> out = new ArrayList<>();
        for (WorkflowState workflow : workflows.values()) {
            if (workflow.status() == WorkflowStatus.ACTIVE) {
                out.add(workflow);
            }
        }
        out.sort(Comparator.comparingLong(WorkflowState::createdAtMs));
        return out;
    }

    public List<String> detectStuck() {
        return detectStuck(clock.getAsLong());
    }

    /**
     * Flags active workflows with no progress for longer than the stuck threshold and asks the
     * orchestrator to recover each of them.
     */
    public List<String> detectStuck(long nowMs) {
        List<String> stuck = new ArrayList<>();
        for (WorkflowState workflow : workflows.values()) {
            if (!workflow.isStuck(nowMs, stuckAfterMs)) {
                continue;
            }
            stuck.add(workflow.workflowId());
            metrics.increment(HubMetrics.WORKFLOWS_STUCK);
            log.warn("workflow appears stuck id={} lastUpdate={}", workflow.workflowId(),
                    Instant.ofEpochMilli(workflow.updatedAtMs()));
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("workflow_id", workflow.workflowId());
            payload.put("stuck_since", Instant.ofEpochMilli(workflow.updatedAtMs()).toString());
            payload.put("participating_agents", workflow.participants());
            SendOutcome sent = bus.send(Message.event("message_bus", orchestratorAgentId, RECOVERY_ACTION, payload, Priority.HIGH)
                    .withCorrelationId(workflow.workflowId()));
            if (!sent.accepted()) {
                log.warn("workflow recovery for {} not delivered: {}", workflow.workflowId(), sent.reason());
            }
        }
        return stuck;
    }

    public int expireWorkflows() {
        return expireWorkflows(clock.getAsLong());
    }

    /** Drops workflows older than the workflow TTL, whatever their status. */
    public int expireWorkflows(long nowMs) {
        int expired = 0;
        for (WorkflowState workflow : new ArrayList<>(workflows.values())) {
            if (nowMs - workflow.createdAtMs() <= workflowTtlMs) {
                continue;
            }
            if (workflows.remove(workflow.workflowId(), workflow)) {
                WorkflowState last = workflow.status().isTerminal() ? workflow : workflow.withStatus(WorkflowStatus.EXPIRED, nowMs);
                complete(last);
                completions.remove(workflow.workflowId());
                state.delete(workflow.workflowId(), Scope.WORKFLOW, ENGINE_AGENT);
                log.info("expired workflow cleaned up id={}", workflow.workflowId());
                expired++;
            }
        }
        return expired;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(stepTimeoutMs, TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private void run(WorkflowState initial, int rounds) {
        try {
            switch (initial.pattern()) {
                case SEQUENTIAL -> runSequential(initial);
                case PARALLEL -> runParallel(initial);
                case ITERATIVE -> runIterative(initial, rounds);
                case ESCALATION -> runEscalation(initial);
                default -> throw new IllegalStateException("unsupported pattern " + initial.pattern());
            }
        } catch (RuntimeException e) {
            log.error("workflow {} failed unexpectedly", initial.workflowId(), e);
            WorkflowState current = workflows.getOrDefault(initial.workflowId(), initial);
            finish(current.stepFailed(ENGINE_AGENT, e.toString(), clock.getAsLong()), WorkflowStatus.FAILED);
        }
    }

    private void runSequential(WorkflowState workflow) {
        WorkflowState current = workflow;
        for (String agent : workflow.participants()) {
            if (abandoned(current)) {
                return;
            }
            StepResult result = await(dispatchStep(current, agent, 1));
            current = advance(current, agent, result);
            if (!result.ok()) {
                finish(current, WorkflowStatus.FAILED);
                return;
            }
        }
        finish(current, WorkflowStatus.COMPLETED);
    }

    private void runParallel(WorkflowState workflow) {
        Map<String, CompletableFuture<Message>> inFlight = new LinkedHashMap<>();
        for (String agent : workflow.participants()) {
            inFlight.put(agent, dispatchStep(workflow, agent, 1));
        }
        WorkflowState current = workflow;
        boolean failed = false;
        for (Map.Entry<String, CompletableFuture<Message>> entry : inFlight.entrySet()) {
            StepResult result = await(entry.getValue());
            long nowMs = clock.getAsLong();
            current = result.ok()
                    ? current.stepCompleted(entry.getKey(), result.payload(), nowMs)
                    : current.stepFailed(entry.getKey(), result.error(), nowMs);
            failed |= !result.ok();
        }
        if (abandoned(current)) {
            return;
        }
        // All participants together count as the single step.
        current = current.atStep(1, clock.getAsLong());
        finish(current, failed ? WorkflowStatus.FAILED : WorkflowStatus.COMPLETED);
    }

    private void runIterative(WorkflowState workflow, int rounds) {
        WorkflowState current = workflow;
        for (int round = 1; round <= rounds; round++) {
            for (String agent : workflow.participants()) {
                if (abandoned(current)) {
                    return;
                }
                StepResult result = await(dispatchStep(current, agent, round));
                current = advance(current, agent, result);
                if (!result.ok()) {
                    finish(current, WorkflowStatus.FAILED);
                    return;
                }
                if (result.payload().path("done").asBoolean(false)) {
                    log.debug("workflow {} terminated by {} in round {}", workflow.workflowId(), agent, round);
                    finish(current, WorkflowStatus.COMPLETED);
                    return;
                }
            }
        }
        log.info("workflow {} used its budget of {} round(s)", workflow.workflowId(), rounds);
        finish(current, WorkflowStatus.COMPLETED);
    }

    private void runEscalation(WorkflowState workflow) {
        WorkflowState current = workflow;
        for (String agent : workflow.participants()) {
            if (abandoned(current)) {
                return;
            }
            StepResult result = await(dispatchStep(current, agent, 1));
            current = advance(current, agent, result);
            if (result.ok()) {
                finish(current, WorkflowStatus.COMPLETED);
                return;
            }
            log.info("workflow {} escalating past {}: {}", workflow.workflowId(), agent, result.error());
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("errors", current.errors());
        details.put("pattern", current.pattern().wireName());
        escalations.escalate(EscalationKind.WORKFLOW_EXHAUSTED, "workflow:" + workflow.workflowId(),
                workflow.participants(), "every escalation level failed", details);
        finish(current, WorkflowStatus.ESCALATED);
    }

    private CompletableFuture<Message> dispatchStep(WorkflowState workflow, String agent, int round) {
        ObjectNode payload = Jsons.object();
        payload.put("workflow_id", workflow.workflowId());
        payload.put("pattern", workflow.pattern().wireName());
        payload.put("step", workflow.currentStep() + 1);
        payload.put("round", round);
        payload.set("context", Jsons.toTree(workflow.context()));
        payload.set("results", Jsons.toTree(workflow.results()));
        String action = String.valueOf(workflow.context().getOrDefault("action", DEFAULT_ACTION));
        Message request = Message.request(ENGINE_AGENT, agent, action, payload, Priority.HIGH)
                .withCorrelationId(workflow.workflowId());
        return bus.dispatch(request);
    }

    private StepResult await(CompletableFuture<Message> reply) {
        try {
            Message message = reply.get(stepTimeoutMs, TimeUnit.MILLISECONDS);
            return new StepResult(true, message.payload(), null);
        } catch (TimeoutException e) {
            return new StepResult(false, Jsons.object(), "step timed out after " + stepTimeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return new StepResult(false, Jsons.object(), cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new StepResult(false, Jsons.object(), "interrupted");
        }
    }

    private WorkflowState advance(WorkflowState current, String agent, StepResult result) {
        long nowMs = clock.getAsLong();
        WorkflowState next = result.ok()
                ? current.stepCompleted(agent, result.payload(), nowMs)
                : current.stepFailed(agent, result.error(), nowMs);
        if (workflows.replace(next.workflowId(), current, next)) {
            save(next);
        }
        return next;
    }

    /** True once the workflow was expired (or replaced) while a step was running. */
    private boolean abandoned(WorkflowState current) {
        WorkflowState live = workflows.get(current.workflowId());
        return live == null || live.status().isTerminal();
    }

    private void finish(WorkflowState current, WorkflowStatus status) {
        WorkflowState last = current.withStatus(status, clock.getAsLong());
        if (workflows.computeIfPresent(last.workflowId(), (id, previous) -> previous.status().isTerminal() ? previous : last) != last) {
            return;
        }
        save(last);
        complete(last);
        log.info("workflow finished id={} status={} steps={}/{} errors={}", last.workflowId(),
                status.wireName(), last.currentStep(), last.totalSteps(), last.errors().size());
    }

    private void complete(WorkflowState last) {
        CompletableFuture<WorkflowState> future = completions.get(last.workflowId());
        if (future != null) {
            future.complete(last);
        }
    }

    private void save(WorkflowState workflow) {
        state.set(workflow.workflowId(), Jsons.toTree(workflow), Scope.WORKFLOW, StateType.WORKFLOW_STATE, ENGINE_AGENT,
                ConsistencyLevel.EVENTUAL, workflowTtlMs, ConflictStrategy.LAST_WRITER_WINS);
    }

    private List<String> escalationOrder(List<String> agents) {
        // Lowest-ranked role first; each failure moves one level up.
        List<String> ordered = new ArrayList<>(agents);
        ordered.sort(Comparator.<String>comparingInt(priorities::priorityOf).reversed());
        return List.copyOf(ordered);
    }

    private int roundBudget(Map<String, Object> context) {
        Object raw = context.get("max_rounds");
        if (raw instanceof Number number && number.intValue() > 0) {
            return number.intValue();
        }
        return Math.max(1, defaultRounds);
    }

    private static WorkflowState parse(StateEntry entry) {
        try {
            return Jsons.mapper().treeToValue(entry.value(), WorkflowState.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse workflow state " + entry.key(), e);
        }
    }

    private record StepResult(boolean ok, JsonNode payload, String error) {
    }
}
