package io.agenthub.conflict;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.agenthub.config.HubConfig;
import io.agenthub.config.HubSettings;
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
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

final class ConflictArbiterTest {

    @Test
    void securityAgentWinsAndIsStillEscalated() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-arbiter-security-");
        try {
            Fixture f = new Fixture(root, HubSettings.defaults());
            AgentConflict conflict = AgentConflict.of(
                    List.of("code_engineer", "security_validator"), "approach", "deploy now or audit first",
                    Map.of("code_engineer", TextNode.valueOf("deploy"), "security_validator", TextNode.valueOf("audit")));

            ConflictDecision decision = f.arbiter.decide(conflict);
            Assertions.assertEquals("security_validator", decision.winner());
            Assertions.assertEquals(ConflictDecision.Basis.SECURITY_OVERRIDE, decision.basis());
            Assertions.assertEquals(TextNode.valueOf("audit"), decision.chosenResolution());
            Assertions.assertTrue(decision.escalated());
            Escalation escalation = f.escalations.find(decision.escalationId()).orElseThrow();
            Assertions.assertEquals(EscalationKind.SECURITY_CONFLICT, escalation.kind());
            Assertions.assertEquals(1L, f.metrics.counter(HubMetrics.CONFLICTS_RESOLVED));
            f.store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void roleHierarchyDecidesWithoutEscalation() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-arbiter-role-");
        try {
            HubSettings settings = HubSettings.fromJson("{\"agentRoles\":{\"yield_scout\":\"information\",\"ops_lead\":\"compliance\"}}");
            Fixture f = new Fixture(root, settings);
            AgentConflict conflict = AgentConflict.of(List.of("yield_scout", "ops_lead"), "resource_allocation", "",
                    Map.<String, JsonNode>of());

            ConflictDecision decision = f.arbiter.decide(conflict);
            Assertions.assertEquals("ops_lead", decision.winner());
            Assertions.assertEquals(ConflictDecision.Basis.ROLE_PRIORITY, decision.basis());
            Assertions.assertFalse(decision.escalated());
            Assertions.assertTrue(f.escalations.open().isEmpty());
            f.store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void roleNamesRenderTheSameUnderAnyDefaultLocale() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-arbiter-locale-");
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            HubSettings settings = HubSettings.fromJson("{\"agentRoles\":{\"yield_scout\":\"information\",\"ops_lead\":\"compliance\"}}");
            Fixture f = new Fixture(root, settings);
            AgentConflict conflict = AgentConflict.of(List.of("yield_scout", "ops_lead"), "resource_allocation", "",
                    Map.<String, JsonNode>of());

            ConflictDecision decision = f.arbiter.decide(conflict);
            Assertions.assertEquals("resolved by role priority: compliance", decision.reasoning());
            f.store.close();
        } finally {
            Locale.setDefault(original);
            deleteRecursively(root);
        }
    }

    @Test
    void unrankedAgentsGoToHumanOversight() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-arbiter-human-");
        try {
            Fixture f = new Fixture(root, HubSettings.defaults());
            ConflictDecision decision = f.arbiter.decide(
                    AgentConflict.of(List.of("bot-1", "bot-2"), "approach", "tabs or spaces", Map.of()));

            Assertions.assertEquals(ConflictDecision.HUMAN_OVERSIGHT, decision.winner());
            Assertions.assertTrue(decision.chosenResolution().path("requires_human_intervention").asBoolean());
            Assertions.assertEquals(1, f.escalations.open().size());

            String id = decision.escalationId();
            Assertions.assertTrue(f.escalations.resolve(id, "use tabs", "operator-1"));
            Assertions.assertFalse(f.escalations.resolve(id, "again", "operator-1"));
            Assertions.assertEquals("use tabs", f.escalations.find(id).orElseThrow().resolution());
            Assertions.assertTrue(f.escalations.open().isEmpty());
            Assertions.assertTrue(f.audit.verifyIntegrity().valid());
            f.store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    private static final class Fixture {
        private final SqliteDurableStore store;
        private final HubMetrics metrics = new HubMetrics();
        private final AuditLogger audit;
        private final HumanEscalations escalations;
        private final ConflictArbiter arbiter;

        private Fixture(Path root, HubSettings settings) {
            HubConfig config = new HubConfig(root, settings);
            Database db = new Database(config);
            db.init();
            this.store = new SqliteDurableStore(db);
            this.audit = new AuditLogger(config.auditFile());
            this.escalations = new HumanEscalations(store, audit, metrics, System::currentTimeMillis);
            this.arbiter = new ConflictArbiter(PriorityModel.fromSettings(settings), escalations, audit, metrics);
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
