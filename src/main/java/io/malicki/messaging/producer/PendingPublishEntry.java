package io.malicki.messaging.producer;

import io.malicki.messaging.domain.message.OutgoingMessage;
import lombok.Value;

import java.time.Instant;

/**
 * A message handed to the transport whose outcome has not arrived yet.
 *
 * @param <C> caller context attached at hand-off (e.g. a publish segment)
 */
@Value
public class PendingPublishEntry<C> {

    String correlationId;
    Instant enqueuedAt;
    OutgoingMessage message;
    C context;
}
