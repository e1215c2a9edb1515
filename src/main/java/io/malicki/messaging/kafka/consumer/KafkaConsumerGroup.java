package io.malicki.messaging.kafka.consumer;

import io.malicki.messaging.retry.ShutdownSignal;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;

import java.util.List;

/**
 * A running consumer group bound to one handler. Closing it cancels any
 * backoff in progress and stops the listener container.
 */
@Slf4j
public class KafkaConsumerGroup implements AutoCloseable {

    @Getter
    private final List<String> topics;
    @Getter
    private final String groupId;
    private final ConcurrentMessageListenerContainer<String, byte[]> container;
    private final ShutdownSignal shutdownSignal;

    KafkaConsumerGroup(
        List<String> topics,
        String groupId,
        ConcurrentMessageListenerContainer<String, byte[]> container,
        ShutdownSignal shutdownSignal
    ) {
        this.topics = List.copyOf(topics);
        this.groupId = groupId;
        this.container = container;
        this.shutdownSignal = shutdownSignal;
    }

    public KafkaConsumerGroup start() {
        log.info("🎧 Starting consumer group | Group: {} | Topics: {}", groupId, topics);
        container.start();
        return this;
    }

    public boolean isRunning() {
        return container.isRunning();
    }

    @Override
    public void close() {
        log.info("Closing consumer group | Group: {} | Topics: {}", groupId, topics);
        shutdownSignal.fire();
        container.stop();
        log.info("Consumer group closed | Group: {}", groupId);
    }
}
