package io.agenthub.conflict;

import com.fasterxml.jackson.databind.JsonNode;
import io.agenthub.observability.AuditLogger;
import io.agenthub.observability.HubMetrics;
import io.agenthub.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the agent whose view prevails when agents disagree.
 * <p>
 * A security agent always wins, but the conflict is still escalated so a human sees it. Otherwise
 * the best-ranked role wins. With no ranked role among the agents the decision goes to human
 * oversight.
 */
public final class ConflictArbiter {
    private static final Logger log = LoggerFactory.getLogger(ConflictArbiter.class);

    private final PriorityModel priorities;
    private final HumanEscalations escalations;
    private final AuditLogger audit;
    private final HubMetrics metrics;

    public ConflictArbiter(PriorityModel priorities, HumanEscalations escalations, AuditLogger audit, HubMetrics metrics) {
        this.priorities = priorities;
        this.escalations = escalations;
        this.audit = audit;
        this.metrics = metrics;
    }

    public ConflictDecision decide(AgentConflict conflict) {
        List<String> agents = conflict.conflictingAgents();
        Comparator<String> byPriority = Comparator.comparingInt(priorities::priorityOf);

        Optional<String> security = agents.stream()
                .filter(a -> priorities.roleOf(a).orElse(null) == AgentRole.SECURITY)
                .min(byPriority);
        ConflictDecision decision;
        if (security.isPresent()) {
            Escalation escalation = escalations.escalate(
                    EscalationKind.SECURITY_CONFLICT, "conflict:" + conflict.id(), agents,
                    "security agent " + security.get() + " overrode conflicting agents", details(conflict));
            decision = new ConflictDecision(
                    conflict.id(), security.get(), ConflictDecision.Basis.SECURITY_OVERRIDE,
                    proposalOf(conflict, security.get()),
                    "security role overrides the hierarchy",
                    agents, escalation.id());
        } else {
            Optional<String> ranked = agents.stream()
                    .filter(a -> priorities.roleOf(a).isPresent())
                    .min(Comparator.comparingInt((String a) -> priorities.roleOf(a).orElseThrow().rank())
                            .thenComparing(byPriority));
            if (ranked.isPresent() && !AgentConflict.SECURITY_CONFLICT.equals(conflict.conflictType())) {
                AgentRole role = priorities.roleOf(ranked.get()).orElseThrow();
                decision = new ConflictDecision(
                        conflict.id(), ranked.get(), ConflictDecision.Basis.ROLE_PRIORITY,
                        proposalOf(conflict, ranked.get()),
                        "resolved by role priority: " + role.name().toLowerCase(Locale.ROOT),
                        agents, null);
            } else {
                String why = ranked.isPresent()
                        ? "security conflict without a security agent"
                        : "no conflicting agent holds a ranked role";
                Escalation escalation = escalations.escalate(
                        EscalationKind.AGENT_CONFLICT, "conflict:" + conflict.id(), agents, why, details(conflict));
                decision = new ConflictDecision(
                        conflict.id(), ConflictDecision.HUMAN_OVERSIGHT, ConflictDecision.Basis.HUMAN_OVERSIGHT,
                        Jsons.object().put("escalated", true).put("requires_human_intervention", true),
                        why, agents, escalation.id());
            }
        }
        metrics.increment(HubMetrics.CONFLICTS_RESOLVED);
        audit.log(AuditLogger.AuditEvent.correlated(
                "conflict.resolve", "hub", "conflict:" + conflict.id(), decision.basis().name().toLowerCase(Locale.ROOT), conflict.id(),
                Map.of("winner", decision.winner(), "agents", agents,
                        "type", conflict.conflictType() == null ? "" : conflict.conflictType())));
        log.info("conflict resolved id={} winner={} basis={}", conflict.id(), decision.winner(), decision.basis());
        return decision;
    }

    private static JsonNode proposalOf(AgentConflict conflict, String agent) {
        JsonNode proposal = conflict.proposals().get(agent);
        return proposal == null ? Jsons.object() : proposal;
    }

    private static Map<String, Object> details(AgentConflict conflict) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("conflict_type", conflict.conflictType() == null ? "" : conflict.conflictType());
        details.put("description", conflict.description() == null ? "" : conflict.description());
        return details;
    }
}
