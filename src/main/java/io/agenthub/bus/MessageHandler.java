package io.agenthub.bus;

import io.agenthub.model.Message;

/**
 * Single entry point of an agent on the bus. Must be safe to call more than once for the same
 * message id, since failed deliveries are retried.
 *
 * @return the reply, or {@code null} when the message needs none
 */
@FunctionalInterface
public interface MessageHandler {
    Message handle(Message message) throws Exception;
}
