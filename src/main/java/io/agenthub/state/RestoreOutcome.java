package io.agenthub.state;

public record RestoreOutcome(
        boolean restored,
        String checkpointName,
        Scope scope,
        int entries,
        String transactionId,
        String reason
) {
}
