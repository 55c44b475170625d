package io.agenthub.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Who may read and write an entry. Enforced by {@link StateAccessPolicy}.
 */
public enum AccessLevel {
    /** Anyone reads and writes. */
    PUBLIC,
    /** Anyone reads; only the owner or a highly ranked agent writes. */
    PROTECTED,
    /** Owner only. */
    PRIVATE,
    /** Gated by the entry's state type and the agent's role. */
    RESTRICTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AccessLevel fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PUBLIC;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
