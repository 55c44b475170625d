package io.agenthub.lock;

public record LockOutcome(
        boolean granted,
        String lockKey,
        String owner,
        LockType type,
        String lockId,
        long expiresAtMs,
        String blockingOwner,
        String reason
) {
    static LockOutcome granted(String lockKey, LockHolder holder) {
        return new LockOutcome(true, lockKey, holder.owner(), holder.type(), holder.lockId(), holder.expiresAtMs(), null, null);
    }

    static LockOutcome denied(String lockKey, String owner, LockType type, String blockingOwner, String reason) {
        return new LockOutcome(false, lockKey, owner, type, null, 0L, blockingOwner, reason);
    }
}
