package io.agenthub.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

public record Request(
        String id,
        String userId,
        String content,
        Priority priority,
        Map<String, Object> context,
        Instant createdAt
) {
    public static final String CAPABILITIES_KEY = "capabilities";

    public Request {
        priority = priority == null ? Priority.MEDIUM : priority;
        context = context == null ? Map.of() : Map.copyOf(context);
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public static Request of(String userId, String content) {
        return new Request(UUID.randomUUID().toString(), userId, content, Priority.MEDIUM, Map.of(), Instant.now());
    }

    public static Request of(String userId, String content, Map<String, Object> context) {
        return new Request(UUID.randomUUID().toString(), userId, content, Priority.MEDIUM, context, Instant.now());
    }

    /** Capability tags the caller attached under {@code context.capabilities}. */
    @JsonIgnore
    public List<String> capabilityTags() {
        Object raw = context.get(CAPABILITIES_KEY);
        List<String> out = new ArrayList<>();
        if (raw instanceof Collection<?> values) {
            for (Object value : values) {
                if (value != null && !value.toString().isBlank()) {
                    out.add(value.toString().trim().toLowerCase(Locale.ROOT));
                }
            }
        } else if (raw instanceof String single && !single.isBlank()) {
            for (String part : single.split(",")) {
                if (!part.isBlank()) {
                    out.add(part.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return out;
    }
}
