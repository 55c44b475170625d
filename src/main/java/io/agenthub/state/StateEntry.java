package io.agenthub.state;

import com.fasterxml.jackson.databind.JsonNode;
import io.agenthub.util.Hashing;
import io.agenthub.util.Jsons;

import java.util.List;

/**
 * One versioned value. The version stored alongside the row in the durable store is authoritative;
 * the copy in the serialized entry is kept for snapshots.
 */
public record StateEntry(
        String key,
        Scope scope,
        JsonNode value,
        String ownerAgent,
        long version,
        long createdAtMs,
        long updatedAtMs,
        long expiresAtMs,
        ConsistencyLevel consistency,
        String checksum,
        List<String> dependencies,
        StateType stateType,
        AccessLevel accessLevel
) {
    public StateEntry {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        accessLevel = accessLevel == null ? AccessLevel.PUBLIC : accessLevel;
    }

    public static String checksumOf(JsonNode value) {
        return Hashing.sha256Hex(Jsons.toCanonicalJson(value));
    }

    public boolean checksumMatches() {
        return checksum != null && checksum.equals(checksumOf(value));
    }

    public boolean isExpired(long nowMs) {
        return expiresAtMs > 0 && expiresAtMs <= nowMs;
    }

    StateEntry withVersion(long authoritative) {
        if (authoritative == version) {
            return this;
        }
        return new StateEntry(key, scope, value, ownerAgent, authoritative, createdAtMs, updatedAtMs, expiresAtMs,
                consistency, checksum, dependencies, stateType, accessLevel);
    }
}
