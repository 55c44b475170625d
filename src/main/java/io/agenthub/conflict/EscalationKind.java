package io.agenthub.conflict;

public enum EscalationKind {
    STATE_CONFLICT,
    AGENT_CONFLICT,
    SECURITY_CONFLICT,
    WORKFLOW_EXHAUSTED,
    CRITICAL_ANOMALY
}
