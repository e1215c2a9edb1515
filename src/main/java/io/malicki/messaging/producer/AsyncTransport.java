package io.malicki.messaging.producer;

import io.malicki.messaging.domain.message.OutgoingMessage;

/**
 * Non-blocking send. The outcome of every accepted message is later reported
 * to the listener given to {@link #bind(TransportListener)}.
 */
public interface AsyncTransport extends AutoCloseable {

    void bind(TransportListener listener);

    /**
     * Hands the message off and returns immediately.
     *
     * @throws io.malicki.messaging.exception.MessagingTransportException when the client can no longer send
     */
    void send(OutgoingMessage message);

    @Override
    void close() throws Exception;
}
