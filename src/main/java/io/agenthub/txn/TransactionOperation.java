package io.agenthub.txn;

import com.fasterxml.jackson.databind.JsonNode;

public record TransactionOperation(
        OperationType type,
        String scope,
        String key,
        JsonNode value,
        String agentId
) {
}
