package io.malicki.messaging.exception;

/**
 * Raised when the underlying broker client fails at the connection level
 * (closed client, lost connection, rejected commit). Never retried internally.
 */
public class MessagingTransportException extends RuntimeException {

    public MessagingTransportException(String message) {
        super(message);
    }

    public MessagingTransportException(String message, Throwable cause) {
        super(message, cause);
    }

}
