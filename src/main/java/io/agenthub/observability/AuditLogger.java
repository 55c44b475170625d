package io.agenthub.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agenthub.security.SensitiveDataMasker;
import io.agenthub.util.Hashing;
import io.agenthub.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail. Each row carries the hash of its predecessor, so editing or
 * dropping a row breaks the chain from that point on.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final ObjectMapper COMPACT_MAPPER = new ObjectMapper().findAndRegisterModules();

    private final Path auditFile;
    private final String signingSecret;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this(auditFile, "");
    }

    public AuditLogger(Path auditFile, String signingSecret) {
        this.auditFile = auditFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("correlation_id", event.correlationId());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path auditFile() {
        return auditFile;
    }

    /**
     * Re-walks the whole file and recomputes every hash link.
     */
    public synchronized IntegrityReport verifyIntegrity() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read audit log: " + auditFile, e);
        }
        String expectedPrev = "";
        int rows = 0;
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            if (line == null || line.isBlank()) {
                continue;
            }
            rows++;
            ObjectNode node;
            try {
                node = (ObjectNode) Jsons.mapper().readTree(line);
            } catch (IOException | ClassCastException e) {
                return IntegrityReport.broken(rows, lineNo, "unparseable row");
            }
            String storedHash = node.path("hash").asText("");
            String storedSignature = node.path("signature").asText("");
            if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                return IntegrityReport.broken(rows, lineNo, "prev_hash does not link to previous row");
            }
            node.remove("hash");
            node.remove("signature");
            String recomputed = Hashing.sha256Hex(toCompactJson(node));
            if (!recomputed.equals(storedHash)) {
                return IntegrityReport.broken(rows, lineNo, "row hash mismatch");
            }
            if (!signingSecret.isBlank() && !Hashing.hmacSha256Hex(signingSecret, storedHash).equals(storedSignature)) {
                return IntegrityReport.broken(rows, lineNo, "signature mismatch");
            }
            expectedPrev = storedHash;
        }
        return new IntegrityReport(rows, true, 0, "");
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            log.warn("audit log tail unreadable, starting a new chain file={}", auditFile, e);
            return "";
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, Map.class);
    }

    private String toCompactJson(Object row) {
        try {
            return COMPACT_MAPPER.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit row", e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String correlationId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String actor,
                String resource,
                String result,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, actor, resource, result, null, details == null ? Map.of() : details);
        }

        public static AuditEvent correlated(
                String action,
                String actor,
                String resource,
                String result,
                String correlationId,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, actor, resource, result, correlationId, details == null ? Map.of() : details);
        }
    }

    public record IntegrityReport(int rowsChecked, boolean valid, int brokenAtLine, String reason) {
        static IntegrityReport broken(int rows, int line, String reason) {
            return new IntegrityReport(rows, false, line, reason);
        }
    }
}
