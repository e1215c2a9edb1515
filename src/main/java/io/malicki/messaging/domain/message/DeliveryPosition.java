package io.malicki.messaging.domain.message;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Where the broker stored a published message.
 */
@Value
@AllArgsConstructor(staticName = "of")
public class DeliveryPosition {

    int partition;
    long offset;
}
