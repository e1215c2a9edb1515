package io.malicki.messaging.exception;

import lombok.Getter;

@Getter
public class DuplicateCorrelationIdException extends IllegalStateException {

    private final String correlationId;

    public DuplicateCorrelationIdException(String correlationId) {
        super("Correlation ID already pending: " + correlationId);
        this.correlationId = correlationId;
    }

}
