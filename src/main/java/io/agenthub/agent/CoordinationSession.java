package io.agenthub.agent;

import io.agenthub.model.Request;
import io.agenthub.model.Response;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One multi-agent fan-out. Lives while responses are collected, or until the session TTL sweep.
 */
public final class CoordinationSession {
    public enum Status {
        ACTIVE,
        COMPLETED,
        EXPIRED
    }

    private final String id;
    private final Request request;
    private final List<String> agents;
    private final long createdAtMs;
    private final Map<String, Response> responses = new ConcurrentHashMap<>();
    private volatile Status status = Status.ACTIVE;

    CoordinationSession(String id, Request request, List<String> agents, long createdAtMs) {
        this.id = id;
        this.request = request;
        this.agents = List.copyOf(agents);
        this.createdAtMs = createdAtMs;
    }

    public String id() {
        return id;
    }

    public Request request() {
        return request;
    }

    public List<String> agents() {
        return agents;
    }

    public long createdAtMs() {
        return createdAtMs;
    }

    public Status status() {
        return status;
    }

    public Map<String, Response> responses() {
        return Map.copyOf(responses);
    }

    void record(Response response) {
        responses.put(response.agentId(), response);
    }

    void markStatus(Status next) {
        status = next;
    }
}
