package io.agenthub.agent;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agenthub.bus.MessageHandler;
import io.agenthub.model.Message;
import io.agenthub.util.Jsons;

import java.time.Instant;
import java.util.List;

/**
 * Replies with what it received. Used by the demo command and in tests as a healthy agent.
 */
public final class EchoAgent implements MessageHandler {
    private final String agentId;

    public EchoAgent(String agentId) {
        this.agentId = agentId;
    }

    public String id() {
        return agentId;
    }

    public AgentDescriptor descriptor(List<String> capabilities) {
        return AgentDescriptor.idle(agentId, "echo", capabilities);
    }

    @Override
    public Message handle(Message message) {
        ObjectNode payload = Jsons.object();
        payload.put("agent", agentId);
        payload.put("timestamp", Instant.now().toString());
        payload.put("action", message.action());
        if (message.correlationId() != null) {
            payload.put("correlation_id", message.correlationId());
        }
        payload.set("received", message.payload());
        return message.reply(payload);
    }
}
