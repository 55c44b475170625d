package io.agenthub.bus;

import io.agenthub.config.HubSettings;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class RetryPolicyTest {

    @Test
    void backoffDoublesPerRetryAndIsCapped() {
        RetryPolicy policy = RetryPolicy.fromSettings(HubSettings.defaults());
        Assertions.assertEquals(1_000L, policy.backoffMs(0));
        Assertions.assertEquals(2_000L, policy.backoffMs(1));
        Assertions.assertEquals(4_000L, policy.backoffMs(2));
        Assertions.assertEquals(8_000L, policy.backoffMs(3));
        Assertions.assertEquals(60_000L, policy.backoffMs(10));
        Assertions.assertEquals(60_000L, policy.backoffMs(500));
    }

    @Test
    void degenerateSettingsAreClamped() {
        RetryPolicy policy = new RetryPolicy(0L, -5L);
        Assertions.assertEquals(1L, policy.unitMs());
        Assertions.assertEquals(1L, policy.maxBackoffMs());
        Assertions.assertEquals(1L, policy.backoffMs(-3));
    }
}
