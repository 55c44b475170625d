package io.agenthub.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.agenthub.model.Response;

import java.util.List;

public record CoordinatedResponse(
        String coordinationId,
        String requestId,
        List<String> participatingAgents,
        JsonNode consolidatedResult,
        List<Response> individualResponses,
        boolean consensusReached,
        double confidenceScore,
        long totalExecutionMs
) {
    public CoordinatedResponse {
        participatingAgents = participatingAgents == null ? List.of() : List.copyOf(participatingAgents);
        individualResponses = individualResponses == null ? List.of() : List.copyOf(individualResponses);
    }
}
