package io.agenthub.state;

import java.util.List;

public record Checkpoint(String name, Scope scope, long createdAtMs, List<StateEntry> entries) {
    public Checkpoint {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static String storeKey(Scope scope, String name) {
        return "checkpoint:" + scope.wireName() + ":" + name;
    }
}
