package io.agenthub.state;

/**
 * Payload published on {@code state_changes:{scope}} after every accepted write or delete.
 */
public record StateChange(
        String operation,
        String key,
        Scope scope,
        StateType stateType,
        String ownerAgent,
        long version,
        long timestamp
) {
    public static final String UPDATED = "updated";
    public static final String DELETED = "deleted";

    public static String channel(Scope scope) {
        return "state_changes:" + scope.wireName();
    }
}
