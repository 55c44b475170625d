package io.agenthub.lock;

public record LockHolder(
        String lockId,
        String owner,
        LockType type,
        long acquiredAtMs,
        long expiresAtMs,
        boolean renewable
) {
    public boolean isLive(long nowMs) {
        return expiresAtMs > nowMs;
    }

    LockHolder renewed(LockType newType, long nowMs, long durationMs) {
        return new LockHolder(lockId, owner, newType, acquiredAtMs, nowMs + durationMs, renewable);
    }
}
