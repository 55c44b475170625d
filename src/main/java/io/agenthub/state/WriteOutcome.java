package io.agenthub.state;

import io.agenthub.conflict.ConflictStrategy;

public record WriteOutcome(
        boolean accepted,
        String key,
        Scope scope,
        long version,
        ConflictStrategy strategy,
        String reason
) {
    static WriteOutcome accepted(String key, Scope scope, long version, ConflictStrategy strategy) {
        return new WriteOutcome(true, key, scope, version, strategy, null);
    }

    static WriteOutcome rejected(String key, Scope scope, long currentVersion, ConflictStrategy strategy, String reason) {
        return new WriteOutcome(false, key, scope, currentVersion, strategy, reason);
    }
}
