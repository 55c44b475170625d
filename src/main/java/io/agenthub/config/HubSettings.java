package io.agenthub.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.agenthub.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables for every component of the hub. Loaded from {@code agenthub-settings.json} under the
 * data root; absent keys fall back to {@link #defaults()} and out-of-range numbers are clamped.
 */
public record HubSettings(
        int maxRetries,
        long backoffUnitMs,
        long maxBackoffMs,
        long handlerTimeoutMs,
        long coordinationWaitMs,
        long lockLeaseMs,
        long transactionTimeoutMs,
        double consensusThreshold,
        double loadThreshold,
        String defaultCapability,
        String orchestratorAgentId,
        long sessionTtlMs,
        long workflowTtlMs,
        long messageRetentionMs,
        long stuckWorkflowMs,
        long heartbeatTimeoutMs,
        long lockSweepIntervalMs,
        long transactionSweepIntervalMs,
        long workflowMonitorIntervalMs,
        long consistencyCheckIntervalMs,
        long sessionSweepIntervalMs,
        long agentHealthIntervalMs,
        int maxConsecutiveHigh,
        int iterativeMaxRounds,
        Map<String, List<String>> capabilityKeywords,
        Map<String, String> agentRoles,
        Map<String, Integer> agentPriorities
) {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_BACKOFF_UNIT_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 60_000L;
    public static final long DEFAULT_LOCK_LEASE_MS = 30_000L;
    public static final long DEFAULT_TRANSACTION_TIMEOUT_MS = 5L * 60L * 1000L;
    public static final double DEFAULT_CONSENSUS_THRESHOLD = 0.6;
    public static final double DEFAULT_LOAD_THRESHOLD = 0.8;
    public static final String DEFAULT_CAPABILITY = "defi";
    public static final String DEFAULT_ORCHESTRATOR = "intent_router";

    public HubSettings {
        capabilityKeywords = copyBuckets(capabilityKeywords);
        agentRoles = agentRoles == null ? Map.of() : Map.copyOf(agentRoles);
        agentPriorities = agentPriorities == null ? Map.of() : Map.copyOf(agentPriorities);
    }

    public static HubSettings defaults() {
        return new HubSettings(
                DEFAULT_MAX_RETRIES,
                DEFAULT_BACKOFF_UNIT_MS,
                DEFAULT_MAX_BACKOFF_MS,
                10_000L,
                30_000L,
                DEFAULT_LOCK_LEASE_MS,
                DEFAULT_TRANSACTION_TIMEOUT_MS,
                DEFAULT_CONSENSUS_THRESHOLD,
                DEFAULT_LOAD_THRESHOLD,
                DEFAULT_CAPABILITY,
                DEFAULT_ORCHESTRATOR,
                60L * 60L * 1000L,
                24L * 60L * 60L * 1000L,
                24L * 60L * 60L * 1000L,
                30L * 60L * 1000L,
                5L * 60L * 1000L,
                30_000L,
                60_000L,
                60_000L,
                300_000L,
                300_000L,
                60_000L,
                100,
                3,
                defaultCapabilityKeywords(),
                Map.of(),
                Map.of()
        );
    }

    public static HubSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            HubSettingsFile parsed = Jsons.mapper().readValue(file.toFile(), HubSettingsFile.class);
            return fromFile(parsed, defaults());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + file, e);
        }
    }

    public static HubSettings fromJson(String json) {
        if (json == null || json.isBlank()) {
            return defaults();
        }
        return fromFile(Jsons.fromJson(json, HubSettingsFile.class), defaults());
    }

    static HubSettings fromFile(HubSettingsFile file, HubSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long backoffUnit = sanitizeLong(file.backoffUnitMs(), defaults.backoffUnitMs(), 1L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), backoffUnit);
        if (maxBackoff < backoffUnit) {
            maxBackoff = backoffUnit;
        }
        Map<String, List<String>> buckets = file.capabilityKeywords() == null || file.capabilityKeywords().isEmpty()
                ? defaults.capabilityKeywords()
                : file.capabilityKeywords();
        return new HubSettings(
                sanitizeInt(file.maxRetries(), defaults.maxRetries(), 0),
                backoffUnit,
                maxBackoff,
                sanitizeLong(file.handlerTimeoutMs(), defaults.handlerTimeoutMs(), 1L),
                sanitizeLong(file.coordinationWaitMs(), defaults.coordinationWaitMs(), 1L),
                sanitizeLong(file.lockLeaseMs(), defaults.lockLeaseMs(), 1L),
                sanitizeLong(file.transactionTimeoutMs(), defaults.transactionTimeoutMs(), 1L),
                sanitizeRatio(file.consensusThreshold(), defaults.consensusThreshold()),
                sanitizeRatio(file.loadThreshold(), defaults.loadThreshold()),
                sanitizeText(file.defaultCapability(), defaults.defaultCapability()),
                sanitizeText(file.orchestratorAgentId(), defaults.orchestratorAgentId()),
                sanitizeLong(file.sessionTtlMs(), defaults.sessionTtlMs(), 1L),
                sanitizeLong(file.workflowTtlMs(), defaults.workflowTtlMs(), 1L),
                sanitizeLong(file.messageRetentionMs(), defaults.messageRetentionMs(), 1L),
                sanitizeLong(file.stuckWorkflowMs(), defaults.stuckWorkflowMs(), 1L),
                sanitizeLong(file.heartbeatTimeoutMs(), defaults.heartbeatTimeoutMs(), 1L),
                sanitizeLong(file.lockSweepIntervalMs(), defaults.lockSweepIntervalMs(), 10L),
                sanitizeLong(file.transactionSweepIntervalMs(), defaults.transactionSweepIntervalMs(), 10L),
                sanitizeLong(file.workflowMonitorIntervalMs(), defaults.workflowMonitorIntervalMs(), 10L),
                sanitizeLong(file.consistencyCheckIntervalMs(), defaults.consistencyCheckIntervalMs(), 10L),
                sanitizeLong(file.sessionSweepIntervalMs(), defaults.sessionSweepIntervalMs(), 10L),
                sanitizeLong(file.agentHealthIntervalMs(), defaults.agentHealthIntervalMs(), 10L),
                sanitizeInt(file.maxConsecutiveHigh(), defaults.maxConsecutiveHigh(), 1),
                sanitizeInt(file.iterativeMaxRounds(), defaults.iterativeMaxRounds(), 1),
                buckets,
                file.agentRoles() == null ? defaults.agentRoles() : file.agentRoles(),
                file.agentPriorities() == null ? defaults.agentPriorities() : file.agentPriorities()
        );
    }

    private static Map<String, List<String>> defaultCapabilityKeywords() {
        Map<String, List<String>> buckets = new LinkedHashMap<>();
        buckets.put("defi", List.of("defi", "swap", "yield", "liquidity", "trade"));
        buckets.put("wallet", List.of("wallet", "transaction", "send", "receive"));
        buckets.put("prediction", List.of("predict", "forecast", "market", "trend"));
        buckets.put("security", List.of("security", "risk", "safe", "audit"));
        buckets.put("productivity", List.of("email", "calendar", "task", "schedule"));
        buckets.put("impact", List.of("climate", "social", "impact", "problem"));
        return buckets;
    }

    private static Map<String, List<String>> copyBuckets(Map<String, List<String>> raw) {
        if (raw == null) {
            return Map.of();
        }
        Map<String, List<String>> out = new LinkedHashMap<>();
        raw.forEach((bucket, keywords) -> out.put(bucket, keywords == null ? List.of() : List.copyOf(keywords)));
        return Collections.unmodifiableMap(out);
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static double sanitizeRatio(Double value, double fallback) {
        if (value == null || value.isNaN()) {
            return fallback;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String sanitizeText(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value.trim();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record HubSettingsFile(
            Integer maxRetries,
            Long backoffUnitMs,
            Long maxBackoffMs,
            Long handlerTimeoutMs,
            Long coordinationWaitMs,
            Long lockLeaseMs,
            Long transactionTimeoutMs,
            Double consensusThreshold,
            Double loadThreshold,
            String defaultCapability,
            String orchestratorAgentId,
            Long sessionTtlMs,
            Long workflowTtlMs,
            Long messageRetentionMs,
            Long stuckWorkflowMs,
            Long heartbeatTimeoutMs,
            Long lockSweepIntervalMs,
            Long transactionSweepIntervalMs,
            Long workflowMonitorIntervalMs,
            Long consistencyCheckIntervalMs,
            Long sessionSweepIntervalMs,
            Long agentHealthIntervalMs,
            Integer maxConsecutiveHigh,
            Integer iterativeMaxRounds,
            Map<String, List<String>> capabilityKeywords,
            Map<String, String> agentRoles,
            Map<String, Integer> agentPriorities
    ) {
    }
}
