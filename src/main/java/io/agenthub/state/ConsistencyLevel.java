package io.agenthub.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConsistencyLevel {
    /** Exclusive lock around every read and write; the cache is bypassed. */
    STRONG,
    EVENTUAL,
    WEAK;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConsistencyLevel fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return EVENTUAL;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
