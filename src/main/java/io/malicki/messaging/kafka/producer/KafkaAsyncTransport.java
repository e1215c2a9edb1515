package io.malicki.messaging.kafka.producer;

import io.malicki.messaging.domain.message.DeliveryPosition;
import io.malicki.messaging.domain.message.OutgoingMessage;
import io.malicki.messaging.exception.MessagingTransportException;
import io.malicki.messaging.producer.AsyncTransport;
import io.malicki.messaging.producer.TransportListener;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.errors.SerializationException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link AsyncTransport} over a {@link KafkaTemplate}; outcomes are reported
 * from the producer's callback thread.
 */
@Slf4j
public class KafkaAsyncTransport implements AsyncTransport {

    private final KafkaTemplate<String, byte[]> kafkaTemplate;
    private final AtomicBoolean used = new AtomicBoolean(false);
    private volatile TransportListener listener;

    public KafkaAsyncTransport(KafkaTemplate<String, byte[]> kafkaTemplate) {
        this.kafkaTemplate = kafkaTemplate;
    }

    @Override
    public void bind(TransportListener listener) {
        this.listener = listener;
    }

    @Override
    public void send(OutgoingMessage message) {
        TransportListener target = listener;
        if (target == null) {
            throw new IllegalStateException("No transport listener bound");
        }

        CompletableFuture<SendResult<String, byte[]>> future;
        used.set(true);
        try {
            future = kafkaTemplate.send(KafkaRecords.toProducerRecord(message));
        } catch (SerializationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MessagingTransportException("Kafka producer rejected message for topic " + message.getTopic(), e);
        }

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                target.onFailure(message, unwrap(ex));
            } else {
                RecordMetadata metadata = result.getRecordMetadata();
                target.onSuccess(message, DeliveryPosition.of(metadata.partition(), metadata.offset()));
            }
        });
    }

    @Override
    public void close() {
        log.info("Closing Kafka async transport");
        // flush() would open a producer just to close it again
        if (used.get()) {
            kafkaTemplate.flush();
            kafkaTemplate.getProducerFactory().reset();
        }
    }

    private static Exception unwrap(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        return cause instanceof Exception
            ? (Exception) cause
            : new MessagingTransportException("Send failed", cause);
    }
}
