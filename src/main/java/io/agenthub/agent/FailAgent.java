package io.agenthub.agent;

import io.agenthub.bus.MessageHandler;
import io.agenthub.model.Message;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

public final class FailAgent implements MessageHandler {
    private final String agentId;
    private final AtomicInteger attempts = new AtomicInteger();

    public FailAgent(String agentId) {
        this.agentId = agentId;
    }

    public String id() {
        return agentId;
    }

    public AgentDescriptor descriptor(List<String> capabilities) {
        return AgentDescriptor.idle(agentId, "fail", capabilities);
    }

    public int attempts() {
        return attempts.get();
    }

    @Override
    public Message handle(Message message) {
        attempts.incrementAndGet();
        throw new IllegalStateException("intentional failure from " + agentId);
    }
}
