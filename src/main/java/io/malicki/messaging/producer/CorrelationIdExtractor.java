package io.malicki.messaging.producer;

import io.malicki.messaging.domain.message.OutgoingMessage;

/**
 * Recovers the ID that ties a delivery outcome back to its publish.
 */
@FunctionalInterface
public interface CorrelationIdExtractor {

    String CORRELATION_ID_HEADER = "X-Correlation-Id";

    /**
     * @return the correlation ID, or null when the message carries none
     */
    String extract(OutgoingMessage message);

    static CorrelationIdExtractor fromHeader() {
        return fromHeader(CORRELATION_ID_HEADER);
    }

    static CorrelationIdExtractor fromHeader(String headerName) {
        return message -> message.header(headerName);
    }
}
