package io.malicki.messaging.producer;

import io.malicki.messaging.domain.message.DeliveryPosition;
import io.malicki.messaging.domain.message.OutgoingMessage;

/**
 * Out-of-band delivery outcomes reported by an {@link AsyncTransport}.
 * May be called from any thread.
 */
public interface TransportListener {

    void onSuccess(OutgoingMessage message, DeliveryPosition position);

    void onFailure(OutgoingMessage message, Exception error);
}
