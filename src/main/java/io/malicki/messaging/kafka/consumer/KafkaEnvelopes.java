package io.malicki.messaging.kafka.consumer;

import io.malicki.messaging.domain.message.Envelope;
import io.malicki.messaging.domain.message.MessageId;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

public final class KafkaEnvelopes {

    private KafkaEnvelopes() {
    }

    public static Envelope from(ConsumerRecord<String, byte[]> record) {
        Map<String, String> headers = new HashMap<>();
        // Duplicate header keys: the last one wins
        for (Header header : record.headers()) {
            headers.put(header.key(), header.value() != null
                ? new String(header.value(), StandardCharsets.UTF_8)
                : "");
        }

        return Envelope.builder()
            .id(MessageId.of(
                record.topic(),
                record.partition(),
                record.offset(),
                record.key() != null ? record.key() : ""))
            .payload(record.value())
            .headers(headers)
            .build();
    }
}
