package io.malicki.messaging.consumer;

import io.malicki.messaging.domain.message.CommitRecord;

/**
 * Durable commit API of the broker client.
 */
@FunctionalInterface
public interface OffsetCommitter {

    void commit(CommitRecord record) throws Exception;
}
