package io.agenthub.observability;

import java.util.Map;

public final class PrometheusFormatter {
    private static final String PREFIX = "agenthub_";

    private PrometheusFormatter() {
    }

    public static String format(HubMetrics.Snapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Long> e : snapshot.counters().entrySet()) {
            appendCounter(sb, PREFIX + e.getKey() + "_total", helpFor(e.getKey()), e.getValue());
        }
        Map<String, Double> load = snapshot.gauges().get(HubMetrics.AGENT_LOAD);
        if (load != null) {
            appendMapGauge(sb, PREFIX + HubMetrics.AGENT_LOAD, "Current agent load between 0 and 1", "agent", load);
        }
        Map<String, Double> depth = snapshot.gauges().get(HubMetrics.QUEUE_DEPTH);
        if (depth != null) {
            appendMapGauge(sb, PREFIX + HubMetrics.QUEUE_DEPTH, "Queued messages by priority tier", "priority", depth);
        }
        for (Map.Entry<String, Map<String, Double>> e : snapshot.gauges().entrySet()) {
            if (HubMetrics.AGENT_LOAD.equals(e.getKey()) || HubMetrics.QUEUE_DEPTH.equals(e.getKey())) {
                continue;
            }
            appendMapGauge(sb, PREFIX + e.getKey(), e.getKey().replace('_', ' '), "label", e.getValue());
        }
        return sb.toString();
    }

    private static String helpFor(String counter) {
        return switch (counter) {
            case HubMetrics.MESSAGES_DEAD_LETTERED -> "Messages moved to the dead-letter set after exhausting retries";
            case HubMetrics.MESSAGES_RETRIED -> "Failed deliveries re-queued with backoff";
            case HubMetrics.CONSENSUS_FAILURES -> "Coordination sessions that did not reach consensus";
            case HubMetrics.LOW_STARVATION -> "Forced low-priority picks triggered by anti-starvation guard";
            default -> counter.replace('_', ' ');
        };
    }

    private static void appendCounter(StringBuilder sb, String metric, String help, long value) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" counter").append('\n');
        sb.append(metric).append(' ').append(value).append('\n');
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Double> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Double> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
