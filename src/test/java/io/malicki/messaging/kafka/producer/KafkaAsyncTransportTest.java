package io.malicki.messaging.kafka.producer;

import io.malicki.messaging.domain.message.DeliveryPosition;
import io.malicki.messaging.domain.message.OutgoingMessage;
import io.malicki.messaging.exception.MessagingTransportException;
import io.malicki.messaging.producer.TransportListener;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Kafka Async Transport Tests")
class KafkaAsyncTransportTest {

    private KafkaTemplate<String, byte[]> kafkaTemplate;
    private TransportListener listener;
    private KafkaAsyncTransport transport;
    private OutgoingMessage message;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        kafkaTemplate = mock(KafkaTemplate.class);
        listener = mock(TransportListener.class);
        transport = new KafkaAsyncTransport(kafkaTemplate);
        transport.bind(listener);
        message = OutgoingMessage.builder()
            .topic("transfers")
            .key("acc-1")
            .payload("hello".getBytes(StandardCharsets.UTF_8))
            .headers(Map.of("X-Correlation-Id", "corr-1"))
            .build();
    }

    @Test
    @DisplayName("Should send a record with key, payload and headers and report the position")
    @SuppressWarnings("unchecked")
    void testSuccessReported() {
        // Given
        CompletableFuture<SendResult<String, byte[]>> future = new CompletableFuture<>();
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(future);

        // When
        transport.send(message);
        ArgumentCaptor<ProducerRecord<String, byte[]>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(captor.capture());
        ProducerRecord<String, byte[]> record = captor.getValue();
        future.complete(new SendResult<>(record,
            new RecordMetadata(new TopicPartition("transfers", 2), 99L, 0, 0L, 5, 5)));

        // Then
        assertThat(record.topic()).isEqualTo("transfers");
        assertThat(record.key()).isEqualTo("acc-1");
        assertThat(record.partition()).isNull();
        assertThat(new String(record.headers().lastHeader("X-Correlation-Id").value(), StandardCharsets.UTF_8))
                .isEqualTo("corr-1");
        verify(listener).onSuccess(message, DeliveryPosition.of(2, 99L));
    }

    @Test
    @DisplayName("Should report broker failures with the original exception")
    @SuppressWarnings("unchecked")
    void testFailureReported() {
        // Given
        TimeoutException timeout = new TimeoutException("expired");
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(CompletableFuture.failedFuture(timeout));

        // When
        transport.send(message);

        // Then
        verify(listener).onFailure(message, timeout);
        verify(listener, never()).onSuccess(any(), any());
    }

    @Test
    @DisplayName("Should wrap producer errors raised at send time")
    @SuppressWarnings("unchecked")
    void testSendTimeErrorWrapped() {
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenThrow(new KafkaException("producer closed"));

        assertThatThrownBy(() -> transport.send(message))
                .isInstanceOf(MessagingTransportException.class)
                .hasCauseInstanceOf(KafkaException.class);
    }

    @Test
    @DisplayName("Should flush and release the producer on close after sending")
    @SuppressWarnings("unchecked")
    void testCloseFlushes() {
        // Given
        ProducerFactory<String, byte[]> producerFactory = mock(ProducerFactory.class);
        when(kafkaTemplate.getProducerFactory()).thenReturn(producerFactory);
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(new CompletableFuture<>());
        transport.send(message);

        // When
        transport.close();

        // Then
        verify(kafkaTemplate).flush();
        verify(producerFactory).reset();
    }

    @Test
    @DisplayName("Should not open a producer on close when nothing was sent")
    void testCloseWithoutSend() {
        transport.close();

        verify(kafkaTemplate, never()).flush();
    }
}
