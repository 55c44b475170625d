package io.agenthub.bus.workflow;

public record WorkflowOutcome(boolean started, String workflowId, String reason) {
    static WorkflowOutcome ok(String workflowId) {
        return new WorkflowOutcome(true, workflowId, null);
    }

    static WorkflowOutcome error(String workflowId, String reason) {
        return new WorkflowOutcome(false, workflowId, reason);
    }
}
