package io.agenthub.conflict;

import java.util.Locale;

public enum ConflictStrategy {
    LAST_WRITER_WINS,
    /** Placeholder for vector-clock ordering; currently accepts like {@link #LAST_WRITER_WINS}. */
    VERSION_VECTOR,
    AGENT_PRIORITY,
    MERGE,
    HUMAN_INTERVENTION;

    public static ConflictStrategy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return LAST_WRITER_WINS;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("LWW".equals(normalized)) {
            return LAST_WRITER_WINS;
        }
        return valueOf(normalized);
    }
}
