package io.malicki.messaging.consumer;

import io.malicki.messaging.domain.message.Envelope;

/**
 * Application callback for one inbound message. Throwing marks the attempt as failed.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(Envelope envelope) throws Exception;
}
