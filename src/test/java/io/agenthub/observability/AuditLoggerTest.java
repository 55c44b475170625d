package io.agenthub.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.agenthub.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void chainSurvivesReopenAndMasksSecrets() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-audit-chain-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger first = new AuditLogger(file, "signing-secret");
            first.log(AuditLogger.AuditEvent.of("agent.register", "oracle", "agent:oracle", "ok",
                    Map.of("api_key", "abc", "capabilities", List.of("prediction"))));
            first.log(AuditLogger.AuditEvent.correlated("message.dead_letter", "bus", "message:m1", "failed", "m1", Map.of()));
            String tail = first.currentHash();

            AuditLogger reopened = new AuditLogger(file, "signing-secret");
            Assertions.assertEquals(tail, reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("runtime.maintenance", "maintenance", "runtime/maintenance", "ok", null));

            AuditLogger.IntegrityReport report = reopened.verifyIntegrity();
            Assertions.assertTrue(report.valid(), report.reason());
            Assertions.assertEquals(3, report.rowsChecked());

            JsonNode row = Jsons.mapper().readTree(Files.readAllLines(file, StandardCharsets.UTF_8).get(0));
            Assertions.assertEquals("***", row.path("details").path("api_key").asText());
            Assertions.assertEquals("prediction", row.path("details").path("capabilities").get(0).asText());
            Assertions.assertEquals("m1", Jsons.mapper().readTree(Files.readAllLines(file, StandardCharsets.UTF_8).get(1))
                    .path("correlation_id").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-audit-tamper-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger audit = new AuditLogger(file);
            audit.log(AuditLogger.AuditEvent.of("state.set", "writer", "state:global:a", "ok", Map.of("version", 1)));
            audit.log(AuditLogger.AuditEvent.of("state.set", "writer", "state:global:a", "ok", Map.of("version", 2)));
            audit.log(AuditLogger.AuditEvent.of("state.delete", "writer", "state:global:a", "ok", Map.of()));

            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.set(1, lines.get(1).replace("\"result\":\"ok\"", "\"result\":\"denied\""));
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.IntegrityReport report = audit.verifyIntegrity();
            Assertions.assertFalse(report.valid());
            Assertions.assertEquals(2, report.brokenAtLine());
            Assertions.assertEquals("row hash mismatch", report.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void signatureIsCheckedWithTheConfiguredSecret() throws Exception {
        Path root = Files.createTempDirectory("agenthub-test-audit-signature-");
        try {
            Path file = root.resolve("audit.log");
            new AuditLogger(file, "right").log(AuditLogger.AuditEvent.of("txn.commit", "coordinator", "txn:1", "ok", Map.of()));

            AuditLogger.IntegrityReport report = new AuditLogger(file, "wrong").verifyIntegrity();
            Assertions.assertFalse(report.valid());
            Assertions.assertEquals("signature mismatch", report.reason());
            Assertions.assertTrue(new AuditLogger(file, "right").verifyIntegrity().valid());
        } finally {
            deleteRecursively(root);
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
