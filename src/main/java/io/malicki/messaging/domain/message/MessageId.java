package io.malicki.messaging.domain.message;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Position of a message in an ordered partition.
 */
@Value
@AllArgsConstructor(staticName = "of")
public class MessageId {

    String topic;
    int partition;
    long offset;
    String key;  // "" when the record carried no key

    @Override
    public String toString() {
        return topic + "-" + partition + "@" + offset;
    }
}
