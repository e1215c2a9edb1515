package io.malicki.messaging.consumer;

import io.malicki.messaging.domain.message.Envelope;

import java.util.Optional;

/**
 * Sequential feed of inbound messages for a single partition.
 */
public interface MessageSource {

    /**
     * Blocks until the next message is available.
     *
     * @return the next message, or empty once the source has no more messages
     * @throws io.malicki.messaging.exception.MessagingTransportException when the broker connection fails
     */
    Optional<Envelope> receive();
}
