package io.malicki.messaging.kafka.producer;

import io.malicki.messaging.domain.message.DeliveryPosition;
import io.malicki.messaging.domain.message.OutgoingMessage;
import io.malicki.messaging.domain.message.PublishOptions;
import io.malicki.messaging.exception.MessagingTransportException;
import io.malicki.messaging.producer.MessagePublisher;
import io.malicki.messaging.producer.OutgoingMessages;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes and waits for the broker acknowledgment.
 */
@Slf4j
public class KafkaSyncPublisher implements MessagePublisher {

    private final KafkaTemplate<String, byte[]> kafkaTemplate;
    private final OutgoingMessages outgoingMessages;
    private final Duration sendTimeout;

    public KafkaSyncPublisher(
        KafkaTemplate<String, byte[]> kafkaTemplate,
        OutgoingMessages outgoingMessages,
        Duration sendTimeout
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.outgoingMessages = outgoingMessages;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public void publish(String topic, byte[] payload, PublishOptions options) {
        send(topic, payload, options);
    }

    public DeliveryPosition send(String topic, byte[] payload, PublishOptions options) {
        OutgoingMessage message = outgoingMessages.prepare(topic, payload, options);

        if (message.isDisablePayloadLogging()) {
            log.info("📤 Sending message | Topic: {} | Key: {}", topic, message.getKey());
        } else {
            log.info("📤 Sending message | Topic: {} | Key: {} | Payload: {}",
                    topic, message.getKey(), message.payloadAsString());
        }

        try {
            SendResult<String, byte[]> result = kafkaTemplate.send(KafkaRecords.toProducerRecord(message))
                .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            RecordMetadata metadata = result.getRecordMetadata();

            log.info("✅ Send message success | Topic: {} | Partition: {} | Offset: {}",
                    topic, metadata.partition(), metadata.offset());
            return DeliveryPosition.of(metadata.partition(), metadata.offset());

        } catch (ExecutionException e) {
            throw new MessagingTransportException("Failed to publish to " + topic, e.getCause());
        } catch (TimeoutException e) {
            throw new MessagingTransportException("Timeout publishing to " + topic, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessagingTransportException("Interrupted publishing to " + topic, e);
        }
    }
}
