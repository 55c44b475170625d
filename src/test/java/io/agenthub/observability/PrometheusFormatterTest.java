package io.agenthub.observability;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class PrometheusFormatterTest {

    @Test
    void rendersCountersAndLabelledGauges() {
        HubMetrics metrics = new HubMetrics();
        metrics.increment(HubMetrics.MESSAGES_DEAD_LETTERED);
        metrics.add(HubMetrics.MESSAGES_SENT, 4L);
        metrics.setGauge(HubMetrics.AGENT_LOAD, "wallet\"bot", 0.25d);
        metrics.setGauge(HubMetrics.QUEUE_DEPTH, "high", 3.0d);

        String text = PrometheusFormatter.format(metrics.snapshot());

        Assertions.assertTrue(text.contains("# TYPE agenthub_messages_sent_total counter\nagenthub_messages_sent_total 4\n"));
        Assertions.assertTrue(text.contains(
                "# HELP agenthub_messages_dead_lettered_total Messages moved to the dead-letter set after exhausting retries"));
        Assertions.assertTrue(text.contains("agenthub_agent_load{agent=\"wallet\\\"bot\"} 0.25"));
        Assertions.assertTrue(text.contains("agenthub_queue_depth{priority=\"high\"} 3.0"));
        Assertions.assertEquals(1, text.split("# TYPE agenthub_queue_depth gauge", -1).length - 1);
    }
}
