package io.agenthub.bus.workflow;

import io.agenthub.config.HubConfig;
import io.agenthub.config.HubSettings;
import io.agenthub.conflict.Escalation;
import io.agenthub.conflict.EscalationKind;
import io.agenthub.model.Message;
import io.agenthub.runtime.AgentHubRuntime;
import io.agenthub.state.Scope;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import java.util.stream.Stream;

final class WorkflowEngineTest {
    private static final String SETTINGS = "{"
            + "\"backoffUnitMs\":1,\"maxBackoffMs\":10,\"handlerTimeoutMs\":5000,\"coordinationWaitMs\":5000,"
            + "\"stuckWorkflowMs\":60000,\"workflowTtlMs\":600000,"
            + "\"agentRoles\":{\"junior\":\"information\",\"senior\":\"compliance\"}"
            + "}";

    @Test
    void sequentialStepsSeePreviousResults() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-workflow-sequential-");
        try (AgentHubRuntime runtime = start(root, System::currentTimeMillis)) {
            List<String> calls = new CopyOnWriteArrayList<>();
            for (String agent : List.of("research", "design", "build")) {
                runtime.bus().registerHandler(agent, message -> {
                    calls.add(agent + " saw " + message.payload().path("results").size());
                    return message.reply(Map.of("by", agent, "step", message.payload().path("step").asInt()));
                });
            }

            WorkflowOutcome outcome = runtime.workflows().startWorkflow("wf-seq", WorkflowPattern.SEQUENTIAL,
                    List.of("research", "design", "build"), Map.of("goal", "ship"));
            Assertions.assertTrue(outcome.started());
            WorkflowState done = runtime.workflows().completion("wf-seq").get(10, TimeUnit.SECONDS);

            Assertions.assertEquals(WorkflowStatus.COMPLETED, done.status());
            Assertions.assertEquals(3, done.currentStep());
            Assertions.assertEquals(List.of("research saw 0", "design saw 1", "build saw 2"), calls);
            Assertions.assertEquals(3, done.results().get("build").path("step").asInt());
            Assertions.assertEquals("completed", runtime.state().get("wf-seq", Scope.WORKFLOW).orElseThrow()
                    .path("status").asText());
            Assertions.assertTrue(runtime.workflows().active().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sequentialWorkflowStopsAtTheFirstFailure() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-workflow-failure-");
        try (AgentHubRuntime runtime = start(root, System::currentTimeMillis)) {
            List<String> calls = new CopyOnWriteArrayList<>();
            runtime.bus().registerHandler("first", message -> {
                calls.add("first");
                return null;
            });
            runtime.bus().registerHandler("broken", message -> {
                throw new IllegalStateException("cannot comply");
            });
            runtime.bus().registerHandler("last", message -> {
                calls.add("last");
                return null;
            });

            runtime.workflows().startWorkflow("wf-fail", WorkflowPattern.SEQUENTIAL, List.of("first", "broken", "last"), null);
            WorkflowState done = runtime.workflows().completion("wf-fail").get(10, TimeUnit.SECONDS);

            Assertions.assertEquals(WorkflowStatus.FAILED, done.status());
            Assertions.assertEquals(List.of("first"), calls);
            Assertions.assertEquals(1, done.currentStep());
            Assertions.assertEquals(1, done.errors().size());
            Assertions.assertTrue(done.errors().get(0).startsWith("broken: "));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void parallelWorkflowCollectsEveryResultAsOneStep() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-workflow-parallel-");
        try (AgentHubRuntime runtime = start(root, System::currentTimeMillis)) {
            for (String agent : List.of("a", "b", "c")) {
                runtime.bus().registerHandler(agent, message -> message.reply(Map.of("vote", agent)));
            }
            runtime.workflows().startWorkflow("wf-par", WorkflowPattern.PARALLEL, List.of("a", "b", "c"), Map.of());
            WorkflowState done = runtime.workflows().completion("wf-par").get(10, TimeUnit.SECONDS);

            Assertions.assertEquals(WorkflowStatus.COMPLETED, done.status());
            Assertions.assertEquals(1, done.currentStep());
            Assertions.assertEquals(1, done.totalSteps());
            Assertions.assertEquals(3, done.results().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void iterativeWorkflowEndsOnDoneOrWhenRoundsRunOut() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-workflow-iterative-");
        try (AgentHubRuntime runtime = start(root, System::currentTimeMillis)) {
            runtime.bus().registerHandler("critic", message ->
                    message.reply(Map.of("done", message.payload().path("round").asInt() == 2)));
            runtime.bus().registerHandler("writer", message -> message.reply(Map.of("draft", true)));

            runtime.workflows().startWorkflow("wf-iter", WorkflowPattern.ITERATIVE, List.of("writer", "critic"),
                    Map.of("max_rounds", 5, "action", "refine"));
            WorkflowState converged = runtime.workflows().completion("wf-iter").get(10, TimeUnit.SECONDS);
            Assertions.assertEquals(WorkflowStatus.COMPLETED, converged.status());
            Assertions.assertEquals(4, converged.currentStep());
            Assertions.assertEquals(10, converged.totalSteps());

            runtime.workflows().startWorkflow("wf-budget", WorkflowPattern.ITERATIVE, List.of("writer"),
                    Map.of("max_rounds", 2));
            WorkflowState exhausted = runtime.workflows().completion("wf-budget").get(10, TimeUnit.SECONDS);
            Assertions.assertEquals(WorkflowStatus.COMPLETED, exhausted.status());
            Assertions.assertEquals(2, exhausted.currentStep());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void escalationClimbsFromTheLowestRankAndEscalatesWhenEveryLevelFails() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-workflow-escalation-");
        try (AgentHubRuntime runtime = start(root, System::currentTimeMillis)) {
            List<String> calls = new CopyOnWriteArrayList<>();
            runtime.bus().registerHandler("junior", message -> {
                calls.add("junior");
                throw new IllegalStateException("out of depth");
            });
            runtime.bus().registerHandler("senior", message -> {
                calls.add("senior");
                return message.reply(Map.of("handled", true));
            });

            runtime.workflows().startWorkflow("wf-up", WorkflowPattern.ESCALATION, List.of("senior", "junior"), Map.of());
            WorkflowState handled = runtime.workflows().completion("wf-up").get(10, TimeUnit.SECONDS);
            Assertions.assertEquals(WorkflowStatus.COMPLETED, handled.status());
            Assertions.assertEquals(List.of("junior", "senior"), handled.participants());
            Assertions.assertEquals("senior", calls.get(calls.size() - 1));

            runtime.bus().registerHandler("senior", message -> {
                throw new IllegalStateException("also stuck");
            });
            runtime.workflows().startWorkflow("wf-exhausted", WorkflowPattern.ESCALATION, List.of("senior", "junior"), Map.of());
            WorkflowState exhausted = runtime.workflows().completion("wf-exhausted").get(10, TimeUnit.SECONDS);
            Assertions.assertEquals(WorkflowStatus.ESCALATED, exhausted.status());
            Assertions.assertEquals(2, exhausted.errors().size());
            Escalation escalation = runtime.escalations().open().get(0);
            Assertions.assertEquals(EscalationKind.WORKFLOW_EXHAUSTED, escalation.kind());
            Assertions.assertEquals("workflow:wf-exhausted", escalation.resource());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void startIsRefusedForUnknownAgentsAndDuplicateIds() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-workflow-validate-");
        try (AgentHubRuntime runtime = start(root, System::currentTimeMillis)) {
            runtime.bus().registerHandler("only", message -> null);
            WorkflowEngine engine = runtime.workflows();

            Assertions.assertEquals("no handler registered for ghost",
                    engine.startWorkflow("wf", WorkflowPattern.SEQUENTIAL, List.of("only", "ghost"), Map.of()).reason());
            Assertions.assertFalse(engine.startWorkflow("wf", WorkflowPattern.PARALLEL, List.of(), Map.of()).started());
            Assertions.assertFalse(engine.startWorkflow(" ", WorkflowPattern.PARALLEL, List.of("only"), Map.of()).started());
            Assertions.assertTrue(engine.startWorkflow("wf", WorkflowPattern.PARALLEL, List.of("only"), Map.of()).started());
            Assertions.assertEquals("workflow already exists",
                    engine.startWorkflow("wf", WorkflowPattern.PARALLEL, List.of("only"), Map.of()).reason());
            Assertions.assertTrue(engine.completion("unknown").isCompletedExceptionally());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stuckWorkflowsTriggerRecoveryAndExpireAfterTheirTtl() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-workflow-stuck-");
        AtomicLong now = new AtomicLong(System.currentTimeMillis());
        CountDownLatch release = new CountDownLatch(1);
        try (AgentHubRuntime runtime = start(root, now::get)) {
            List<Message> recoveries = new CopyOnWriteArrayList<>();
            CountDownLatch recovered = new CountDownLatch(1);
            runtime.bus().registerHandler("intent_router", message -> {
                recoveries.add(message);
                recovered.countDown();
                return null;
            });
            runtime.bus().registerHandler("slow", message -> {
                release.await(10, TimeUnit.SECONDS);
                return null;
            });

            runtime.workflows().startWorkflow("wf-stuck", WorkflowPattern.SEQUENTIAL, List.of("slow"), Map.of());
            Assertions.assertEquals(1, runtime.workflows().active().size());
            Assertions.assertTrue(runtime.workflows().detectStuck(now.get()).isEmpty());

            now.addAndGet(60_001L);
            Assertions.assertEquals(List.of("wf-stuck"), runtime.workflows().detectStuck(now.get()));
            Assertions.assertTrue(recovered.await(5, TimeUnit.SECONDS));
            Message recovery = recoveries.get(0);
            Assertions.assertEquals(WorkflowEngine.RECOVERY_ACTION, recovery.action());
            Assertions.assertEquals("wf-stuck", recovery.payload().path("workflow_id").asText());

            Assertions.assertEquals(1, runtime.workflows().expireWorkflows(now.get() + 600_000L));
            WorkflowState expired = runtime.workflows().completion("wf-stuck").get(1, TimeUnit.SECONDS);
            Assertions.assertEquals(WorkflowStatus.EXPIRED, expired.status());
            Assertions.assertTrue(runtime.workflows().active().isEmpty());
            release.countDown();
        } finally {
            release.countDown();
            deleteRecursively(root);
        }
    }

    private static AgentHubRuntime start(Path root, LongSupplier clock) {
        AgentHubRuntime runtime = new AgentHubRuntime(new HubConfig(root, HubSettings.fromJson(SETTINGS)), clock);
        runtime.start();
        return runtime;
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
