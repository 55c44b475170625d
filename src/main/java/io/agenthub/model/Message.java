package io.agenthub.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.agenthub.util.Jsons;

import java.time.Instant;
import java.util.UUID;

/**
 * Wire-level message exchanged between agents. Immutable; retries produce copies with a higher
 * {@code retry_count}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        @JsonProperty("id") String id,
        @JsonProperty("from") String from,
        @JsonProperty("to") String to,
        @JsonProperty("type") MessageType type,
        @JsonProperty("action") String action,
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("priority") Priority priority,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("correlation_id") String correlationId,
        @JsonProperty("in_reply_to") String inReplyTo,
        @JsonProperty("expires_at") Instant expiresAt,
        @JsonProperty("retry_count") int retryCount,
        @JsonProperty("max_retries") int maxRetries
) {
    public static final int DEFAULT_MAX_RETRIES = 3;

    public Message {
        payload = payload == null ? Jsons.object() : payload;
        priority = priority == null ? Priority.MEDIUM : priority;
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static Message of(String from, String to, MessageType type, String action, Object payload, Priority priority) {
        return new Message(
                UUID.randomUUID().toString(),
                from,
                to,
                type,
                action,
                Jsons.toTree(payload),
                priority,
                Instant.now(),
                null,
                null,
                null,
                0,
                DEFAULT_MAX_RETRIES
        );
    }

    public static Message request(String from, String to, String action, Object payload, Priority priority) {
        return of(from, to, MessageType.REQUEST, action, payload, priority);
    }

    public static Message event(String from, String to, String action, Object payload, Priority priority) {
        return of(from, to, MessageType.EVENT, action, payload, priority);
    }

    /** Response to this message, sent back from its recipient. */
    public Message reply(Object replyPayload) {
        return new Message(
                UUID.randomUUID().toString(),
                to,
                from,
                MessageType.RESPONSE,
                action,
                Jsons.toTree(replyPayload),
                priority,
                Instant.now(),
                correlationId,
                id,
                null,
                0,
                maxRetries
        );
    }

    public Message withRetryCount(int count) {
        return new Message(id, from, to, type, action, payload, priority, timestamp,
                correlationId, inReplyTo, expiresAt, count, maxRetries);
    }

    public Message withMaxRetries(int max) {
        return new Message(id, from, to, type, action, payload, priority, timestamp,
                correlationId, inReplyTo, expiresAt, retryCount, max);
    }

    public Message withCorrelationId(String correlation) {
        return new Message(id, from, to, type, action, payload, priority, timestamp,
                correlation, inReplyTo, expiresAt, retryCount, maxRetries);
    }

    public Message withExpiresAt(Instant expiry) {
        return new Message(id, from, to, type, action, payload, priority, timestamp,
                correlationId, inReplyTo, expiry, retryCount, maxRetries);
    }

    public Message withPriority(Priority newPriority) {
        return new Message(id, from, to, type, action, payload, newPriority, timestamp,
                correlationId, inReplyTo, expiresAt, retryCount, maxRetries);
    }

    @JsonIgnore
    public boolean isExpired(long nowMs) {
        return expiresAt != null && expiresAt.toEpochMilli() <= nowMs;
    }

    @JsonIgnore
    public boolean retriesExhausted() {
        return retryCount >= maxRetries;
    }
}
