package io.malicki.messaging.producer;

import io.malicki.messaging.domain.message.OutgoingMessage;
import io.malicki.messaging.domain.message.PublishOptions;
import io.malicki.messaging.exception.EmptyTopicException;
import io.malicki.messaging.exception.MissingPayloadException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Validates publish requests and turns them into {@link OutgoingMessage}s.
 */
public final class OutgoingMessages {

    private final Supplier<String> idGenerator;
    private final String correlationHeader;

    public OutgoingMessages() {
        this(() -> UUID.randomUUID().toString(), CorrelationIdExtractor.CORRELATION_ID_HEADER);
    }

    public OutgoingMessages(Supplier<String> idGenerator, String correlationHeader) {
        this.idGenerator = idGenerator;
        this.correlationHeader = correlationHeader;
    }

    public OutgoingMessage prepare(String topic, byte[] payload, PublishOptions options) {
        if (topic == null || topic.isBlank()) {
            throw new EmptyTopicException();
        }
        if (payload == null || payload.length == 0) {
            throw new MissingPayloadException(topic);
        }
        PublishOptions opts = options != null ? options : PublishOptions.none();

        String key = opts.getKey();
        if (key == null || key.isEmpty()) {
            key = idGenerator.get();
        }

        Map<String, String> headers = new LinkedHashMap<>(opts.getHeaders());
        String correlationId = headers.get(correlationHeader);
        if (correlationId == null || correlationId.isBlank()) {
            headers.put(correlationHeader, idGenerator.get());
        }

        return OutgoingMessage.builder()
            .topic(topic)
            .key(key)
            .partition(opts.getPartition())
            .payload(payload)
            .headers(headers)
            .disablePayloadLogging(opts.isDisablePayloadLogging())
            .build();
    }
}
