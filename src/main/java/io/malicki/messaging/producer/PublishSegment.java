package io.malicki.messaging.producer;

import io.malicki.messaging.domain.message.DeliveryPosition;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Timing context of one asynchronous publish, from hand-off to outcome.
 */
@Value
public class PublishSegment {

    String topic;
    String key;
    Instant startedAt;

    public Duration elapsed(Instant now) {
        return Duration.between(startedAt, now);
    }

    public String describe(DeliveryPosition position) {
        return position != null
            ? String.format("%s[%d]@%d", topic, position.getPartition(), position.getOffset())
            : topic;
    }
}
