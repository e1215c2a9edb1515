package io.malicki.messaging.exception;

import io.malicki.messaging.domain.message.MessageId;
import lombok.Getter;

/**
 * An {@link Error} thrown by a message handler, recovered at the pipeline
 * boundary and treated as a regular failed attempt.
 */
@Getter
public class HandlerPanicException extends RuntimeException {

    private final MessageId messageId;

    public HandlerPanicException(MessageId messageId, Throwable cause) {
        super(String.format("Handler panicked on %s-%d@%d: %s",
                messageId.getTopic(), messageId.getPartition(), messageId.getOffset(), cause),
            cause);
        this.messageId = messageId;
    }

}
