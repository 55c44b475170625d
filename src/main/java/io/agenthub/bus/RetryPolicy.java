package io.agenthub.bus;

import io.agenthub.config.HubSettings;

/**
 * Exponential backoff: the wait after the n-th failed delivery is {@code unit * 2^n}, capped.
 */
public record RetryPolicy(long unitMs, long maxBackoffMs) {
    public RetryPolicy {
        unitMs = Math.max(1L, unitMs);
        maxBackoffMs = Math.max(unitMs, maxBackoffMs);
    }

    public static RetryPolicy fromSettings(HubSettings settings) {
        return new RetryPolicy(settings.backoffUnitMs(), settings.maxBackoffMs());
    }

    public long backoffMs(int retryCount) {
        int exponent = Math.max(0, Math.min(30, retryCount));
        return Math.min(unitMs * (1L << exponent), maxBackoffMs);
    }
}
