package io.malicki.messaging.kafka.consumer;

import io.malicki.messaging.consumer.MessageHandler;
import io.malicki.messaging.consumer.ProcessingReporter;
import io.malicki.messaging.kafka.config.MessagingProperties;
import io.malicki.messaging.retry.BackoffPolicy;
import io.malicki.messaging.retry.ShutdownSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.listener.CommonContainerStoppingErrorHandler;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ContainerProperties;

import java.util.Collection;
import java.util.List;

/**
 * Registers handlers: each call creates a consumer group whose records go
 * through the retrying pipeline.
 */
@Slf4j
public class KafkaConsumerGroupFactory {

    private final ConsumerFactory<String, byte[]> consumerFactory;
    private final MessagingProperties properties;
    private final BackoffPolicy backoffPolicy;
    private final ProcessingReporter reporter;

    public KafkaConsumerGroupFactory(
        ConsumerFactory<String, byte[]> consumerFactory,
        MessagingProperties properties,
        ProcessingReporter reporter
    ) {
        this.consumerFactory = consumerFactory;
        this.properties = properties;
        this.backoffPolicy = properties.getConsumer().getRetry().toBackoffPolicy();
        this.reporter = reporter;
    }

    public KafkaConsumerGroup create(String topic, MessageHandler handler) {
        return create(List.of(topic), handler);
    }

    public KafkaConsumerGroup create(Collection<String> topics, MessageHandler handler) {
        if (topics.isEmpty() || topics.stream().anyMatch(t -> t == null || t.isBlank())) {
            throw new IllegalArgumentException("Topics must not be empty: " + topics);
        }
        MessagingProperties.ConsumerProperties consumer = properties.getConsumer();
        String groupId = properties.groupId();
        ShutdownSignal shutdownSignal = new ShutdownSignal();

        ContainerProperties containerProperties = new ContainerProperties(topics.toArray(new String[0]));
        containerProperties.setGroupId(groupId);
        containerProperties.setClientId(properties.clientId());
        // Offsets are committed by the pipeline itself, one record at a time
        containerProperties.setAckMode(ContainerProperties.AckMode.MANUAL);
        containerProperties.setMessageListener(new RetryingRecordListener(
            handler,
            backoffPolicy,
            reporter,
            shutdownSignal,
            consumer.isDisablePayloadLogging()
        ));

        ConcurrentMessageListenerContainer<String, byte[]> container =
            new ConcurrentMessageListenerContainer<>(consumerFactory, containerProperties);
        container.setConcurrency(consumer.getConcurrency());
        container.setBeanName("messaging-" + groupId + "-" + String.join("-", topics));
        // Handler failures never reach the container; anything that does is a broker failure
        container.setCommonErrorHandler(new CommonContainerStoppingErrorHandler());

        log.info("Kafka consumer initialized | Group: {} | Topics: {} | Client: {} | Servers: {}",
                groupId, topics, properties.clientId(), properties.getBootstrapServers());

        return new KafkaConsumerGroup(List.copyOf(topics), groupId, container, shutdownSignal);
    }
}
