package io.agenthub.bus.workflow;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of one multi-agent workflow. Every transition produces a new copy that the engine
 * persists in the {@code workflow} state scope.
 */
public record WorkflowState(
        String workflowId,
        WorkflowPattern pattern,
        List<String> participants,
        int currentStep,
        int totalSteps,
        WorkflowStatus status,
        Map<String, Object> context,
        Map<String, JsonNode> results,
        List<String> errors,
        long createdAtMs,
        long updatedAtMs
) {
    public WorkflowState {
        participants = participants == null ? List.of() : List.copyOf(participants);
        context = context == null ? Map.of() : Map.copyOf(context);
        results = results == null ? Map.of() : Map.copyOf(results);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    static WorkflowState started(String id, WorkflowPattern pattern, List<String> participants, int totalSteps,
                                 Map<String, Object> context, long nowMs) {
        return new WorkflowState(id, pattern, participants, 0, totalSteps, WorkflowStatus.ACTIVE,
                context, Map.of(), List.of(), nowMs, nowMs);
    }

    WorkflowState stepCompleted(String agentId, JsonNode result, long nowMs) {
        Map<String, JsonNode> merged = new LinkedHashMap<>(results);
        merged.put(agentId, result);
        return new WorkflowState(workflowId, pattern, participants, currentStep + 1, totalSteps, status,
                context, merged, errors, createdAtMs, nowMs);
    }

    WorkflowState stepFailed(String agentId, String error, long nowMs) {
        List<String> appended = new ArrayList<>(errors);
        appended.add(agentId + ": " + error);
        return new WorkflowState(workflowId, pattern, participants, currentStep, totalSteps, status,
                context, results, appended, createdAtMs, nowMs);
    }

    WorkflowState withStatus(WorkflowStatus next, long nowMs) {
        return new WorkflowState(workflowId, pattern, participants, currentStep, totalSteps, next,
                context, results, errors, createdAtMs, nowMs);
    }

    WorkflowState atStep(int step, long nowMs) {
        return new WorkflowState(workflowId, pattern, participants, step, totalSteps, status,
                context, results, errors, createdAtMs, nowMs);
    }

    @JsonIgnore
    public boolean isStuck(long nowMs, long stuckAfterMs) {
        return status == WorkflowStatus.ACTIVE && nowMs - updatedAtMs > stuckAfterMs;
    }
}
