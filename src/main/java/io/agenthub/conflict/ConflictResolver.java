package io.agenthub.conflict;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

public final class ConflictResolver {
    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    private final PriorityModel priorities;
    private final HumanEscalations escalations;

    public ConflictResolver(PriorityModel priorities, HumanEscalations escalations) {
        this.priorities = priorities;
        this.escalations = escalations;
    }

    public PriorityModel priorities() {
        return priorities;
    }

    /**
     * Decides what value a write over an existing entry should store, or whether it is rejected.
     */
    public Resolution resolve(
            ConflictStrategy strategy,
            String resource,
            JsonNode existingValue,
            String existingOwner,
            JsonNode incoming,
            String writer
    ) {
        ConflictStrategy effective = strategy == null ? ConflictStrategy.LAST_WRITER_WINS : strategy;
        return switch (effective) {
            case LAST_WRITER_WINS, VERSION_VECTOR -> Resolution.accept(incoming);
            case AGENT_PRIORITY -> byPriority(resource, existingOwner, incoming, writer);
            case MERGE -> Resolution.accept(shallowMerge(existingValue, incoming));
            case HUMAN_INTERVENTION -> {
                log.warn("human intervention required resource={} existing_owner={} writer={}",
                        resource, existingOwner, writer);
                escalations.escalate(
                        EscalationKind.STATE_CONFLICT,
                        resource,
                        List.of(existingOwner == null ? "" : existingOwner, writer),
                        "write held for manual review",
                        Map.of("proposed_value", incoming == null ? "null" : incoming.toString())
                );
                yield Resolution.reject("human intervention required");
            }
        };
    }

    private Resolution byPriority(String resource, String existingOwner, JsonNode incoming, String writer) {
        int existing = priorities.priorityOf(existingOwner);
        int challenger = priorities.priorityOf(writer);
        if (challenger <= existing) {
            return Resolution.accept(incoming);
        }
        log.info("write rejected by agent priority resource={} writer={} writer_priority={} owner={} owner_priority={}",
                resource, writer, challenger, existingOwner, existing);
        return Resolution.reject("writer priority " + challenger + " is lower than owner priority " + existing);
    }

    /**
     * Top-level keys of {@code incoming} replace those of {@code existing}; nested objects are not
     * merged. Non-object values are overwritten.
     */
    static JsonNode shallowMerge(JsonNode existing, JsonNode incoming) {
        if (existing == null || incoming == null || !existing.isObject() || !incoming.isObject()) {
            return incoming;
        }
        ObjectNode merged = ((ObjectNode) existing).deepCopy();
        merged.setAll((ObjectNode) incoming);
        return merged;
    }
}
