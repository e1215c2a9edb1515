package io.malicki.messaging.kafka.consumer;

import io.malicki.messaging.consumer.OffsetCommitter;
import io.malicki.messaging.domain.message.CommitRecord;
import io.malicki.messaging.domain.message.MessageId;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;

import java.util.Map;

/**
 * Commits synchronously through the consumer that delivered the record.
 * Must be called on that consumer's polling thread.
 */
public class KafkaOffsetCommitter implements OffsetCommitter {

    private final Consumer<?, ?> consumer;

    public KafkaOffsetCommitter(Consumer<?, ?> consumer) {
        this.consumer = consumer;
    }

    @Override
    public void commit(CommitRecord record) {
        MessageId id = record.getId();
        consumer.commitSync(Map.of(
            new TopicPartition(id.getTopic(), id.getPartition()),
            new OffsetAndMetadata(record.getNextOffset())
        ));
    }
}
