package io.malicki.messaging.producer;

import io.malicki.messaging.domain.message.DeliveryPosition;
import io.malicki.messaging.domain.message.OutgoingMessage;

/**
 * Observability seam of the acknowledgment matcher. All callbacks run on the
 * matcher's loop thread.
 *
 * @param <C> context created at hand-off and returned with the outcome
 */
public interface PublishObserver<C> {

    C onHandedOff(OutgoingMessage message);

    void onAcknowledged(PendingPublishEntry<C> entry, DeliveryPosition position);

    void onFailed(PendingPublishEntry<C> entry, Exception error);

    /**
     * An outcome whose correlation ID is not pending. Position or error may be null.
     */
    default void onUnmatched(OutgoingMessage message, DeliveryPosition position, Exception error) {
    }

    /**
     * Entry dropped by TTL eviction without an outcome.
     */
    default void onExpired(PendingPublishEntry<C> entry) {
    }
}
