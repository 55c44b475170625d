package io.agenthub.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.agenthub.config.HubConfig;
import io.agenthub.config.HubSettings;
import io.agenthub.conflict.AgentConflict;
import io.agenthub.conflict.ConflictDecision;
import io.agenthub.error.ErrorKind;
import io.agenthub.error.HubException;
import io.agenthub.model.Message;
import io.agenthub.model.Request;
import io.agenthub.model.Response;
import io.agenthub.observability.HubMetrics;
import io.agenthub.runtime.AgentHubRuntime;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

final class AgentRouterTest {
    private static final String SETTINGS =
            "{\"backoffUnitMs\":1,\"maxBackoffMs\":10,\"handlerTimeoutMs\":2000,\"coordinationWaitMs\":5000}";

    @Test
    void consensusNeedsThresholdShareOfDispatchedAgents() {
        Assertions.assertTrue(AgentRouter.consensusReached(3, 5, 0.6));
        Assertions.assertFalse(AgentRouter.consensusReached(2, 5, 0.6));
        Assertions.assertTrue(AgentRouter.consensusReached(1, 1, 0.6));
        Assertions.assertFalse(AgentRouter.consensusReached(0, 0, 0.6));

        Assertions.assertEquals(0.0d, AgentRouter.confidenceScore(0));
        Assertions.assertEquals(0.5d, AgentRouter.confidenceScore(1), 1e-9);
        Assertions.assertEquals(0.7d, AgentRouter.confidenceScore(3), 1e-9);
        Assertions.assertEquals(1.0d, AgentRouter.confidenceScore(12), 1e-9);

        JsonNode empty = AgentRouter.consolidate(List.of());
        Assertions.assertEquals("No valid responses received", empty.path("error").asText());
    }

    @Test
    void classifiesByKeywordAndExplicitTags() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-router-classify-");
        try (AgentHubRuntime runtime = open(root)) {
            AgentRouter router = runtime.router();
            Assertions.assertEquals(Set.of("defi", "wallet"),
                    router.classify(Request.of("u1", "Swap ETH from my WALLET")));
            Assertions.assertEquals(List.of("security", "research"), new ArrayList<>(router.classify(
                    Request.of("u1", "is this contract safe?", Map.of("capabilities", List.of("Research"))))));
            Assertions.assertTrue(router.classify(Request.of("u1", "hello there")).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void singleMatchingAgentAnswersDirectly() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-router-single-");
        try (AgentHubRuntime runtime = open(root)) {
            EchoAgent swapper = new EchoAgent("swapper");
            runtime.registry().register(swapper.descriptor(List.of("defi")), swapper);
            EchoAgent forecaster = new EchoAgent("forecaster");
            runtime.registry().register(forecaster.descriptor(List.of("prediction")), forecaster);

            Request request = Request.of("u1", "swap 1 ETH for USDC");
            Response response = runtime.router().route(request);

            Assertions.assertEquals("swapper", response.agentId());
            Assertions.assertEquals(request.id(), response.requestId());
            Assertions.assertTrue(response.isSuccess());
            Assertions.assertEquals("swap 1 ETH for USDC", response.result().path("received").path("content").asText());
            Assertions.assertEquals(1L, runtime.registry().performance().stream()
                    .filter(p -> p.agentId().equals("swapper")).findFirst().orElseThrow().successes());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unmatchedRequestFallsBackToTheDefaultCapability() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-router-default-");
        try (AgentHubRuntime runtime = open(root)) {
            EchoAgent generalist = new EchoAgent("generalist");
            runtime.registry().register(generalist.descriptor(List.of("defi")), generalist);
            Assertions.assertEquals(List.of("generalist"), runtime.router().selectAgents(Request.of("u1", "hello")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void routingFailsWithoutAvailableAgents() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-router-none-");
        try (AgentHubRuntime runtime = open(root)) {
            EchoAgent busy = new EchoAgent("busy");
            runtime.registry().register(busy.descriptor(List.of("defi")), busy);
            runtime.registry().heartbeat("busy", AgentStatus.IDLE, 0.95d);

            HubException error = Assertions.assertThrows(HubException.class,
                    () -> runtime.router().route(Request.of("u1", "swap tokens")));
            Assertions.assertEquals(ErrorKind.ROUTING, error.kind());
            Assertions.assertEquals(1L, runtime.metrics().counter(HubMetrics.ROUTING_FAILURES));

            FailAgent broken = new FailAgent("broken");
            runtime.registry().register(broken.descriptor(List.of("wallet")), broken);
            HubException failed = Assertions.assertThrows(HubException.class,
                    () -> runtime.router().route(Request.of("u1", "open my wallet")));
            Assertions.assertEquals(ErrorKind.DELIVERY_FAILURE, failed.kind());
            Assertions.assertEquals(3, broken.attempts());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void threeOfFiveRepliesReachConsensus() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-router-consensus-");
        try (AgentHubRuntime runtime = open(root)) {
            List<String> agents = registerMixed(runtime, 3, 2);
            CoordinatedResponse coordinated = runtime.router().coordinate(Request.of("u1", "trade plan"), agents);

            Assertions.assertTrue(coordinated.consensusReached());
            Assertions.assertEquals(0.7d, coordinated.confidenceScore(), 1e-9);
            Assertions.assertEquals(3, coordinated.individualResponses().size());
            Assertions.assertEquals(5, coordinated.participatingAgents().size());
            Assertions.assertEquals(3, coordinated.consolidatedResult().path("agent_count").asInt());
            Assertions.assertEquals(2, coordinated.consolidatedResult().path("supporting_results").size());
            Assertions.assertTrue(runtime.router().activeSessions().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void twoOfFiveRepliesDoNotReachConsensus() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-router-no-consensus-");
        try (AgentHubRuntime runtime = open(root)) {
            registerMixed(runtime, 2, 3);
            Response response = runtime.router().route(Request.of("u1", "yield strategy"));

            Assertions.assertEquals(Response.COORDINATED, response.agentId());
            Assertions.assertEquals(Response.Status.PARTIAL, response.status());
            Assertions.assertEquals(Boolean.FALSE, response.metadata().get("consensus_reached"));
            Assertions.assertEquals(0.6d, (Double) response.metadata().get("confidence_score"), 1e-9);
            Assertions.assertEquals(1L, runtime.metrics().counter(HubMetrics.CONSENSUS_FAILURES));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void replyWithErrorStatusCountsAsFailure() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-router-error-status-");
        try (AgentHubRuntime runtime = open(root)) {
            runtime.registry().register(AgentDescriptor.idle("grumpy", "test", List.of("defi")),
                    message -> message.reply(Map.of("status", "error", "error", "rate limited")));
            CoordinatedResponse coordinated = runtime.router().coordinate(Request.of("u1", "swap"), List.of("grumpy"));

            Assertions.assertFalse(coordinated.consensusReached());
            Assertions.assertEquals(0.0d, coordinated.confidenceScore());
            Assertions.assertEquals("No valid responses received", coordinated.consolidatedResult().path("error").asText());
            Assertions.assertThrows(HubException.class,
                    () -> runtime.router().coordinate(Request.of("u1", "swap"), List.of()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void resolvedConflictIsAnnouncedToEveryAffectedAgent() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-router-conflict-");
        try (AgentHubRuntime runtime = open(root)) {
            List<String> notices = new CopyOnWriteArrayList<>();
            for (String agent : List.of("security_validator", "code_engineer")) {
                runtime.registry().register(AgentDescriptor.idle(agent, "test", List.of("security")), message -> {
                    notices.add(agent + ":" + message.action() + ":" + message.payload().path("winner").asText());
                    return null;
                });
            }

            ConflictDecision decision = runtime.router().resolveConflict(AgentConflict.of(
                    List.of("code_engineer", "security_validator"), "approach", "ship or audit",
                    Map.of("security_validator", TextNode.valueOf("audit"))));
            Assertions.assertTrue(runtime.bus().awaitIdle(5_000L));

            Assertions.assertEquals("security_validator", decision.winner());
            Assertions.assertEquals(2, notices.size());
            Assertions.assertTrue(notices.contains("code_engineer:conflict_resolved:security_validator"));
            Assertions.assertEquals(1, runtime.escalations().open().size());
        } finally {
            deleteRecursively(root);
        }
    }

    private static List<String> registerMixed(AgentHubRuntime runtime, int healthy, int failing) {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < healthy; i++) {
            EchoAgent agent = new EchoAgent("ok-" + i);
            runtime.registry().register(agent.descriptor(List.of("defi")), agent);
            ids.add(agent.id());
        }
        for (int i = 0; i < failing; i++) {
            FailAgent agent = new FailAgent("bad-" + i);
            runtime.registry().register(agent.descriptor(List.of("defi")), agent);
            ids.add(agent.id());
        }
        return ids;
    }

    private static AgentHubRuntime open(Path root) {
        AgentHubRuntime runtime = new AgentHubRuntime(new HubConfig(root, HubSettings.fromJson(SETTINGS)));
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
