package io.malicki.messaging.kafka.producer;

import io.malicki.messaging.domain.message.OutgoingMessage;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.internals.RecordHeader;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class KafkaRecords {

    private KafkaRecords() {
    }

    public static ProducerRecord<String, byte[]> toProducerRecord(OutgoingMessage message) {
        List<Header> headers = new ArrayList<>(message.getHeaders().size());
        for (Map.Entry<String, String> header : message.getHeaders().entrySet()) {
            headers.add(new RecordHeader(header.getKey(), header.getValue().getBytes(StandardCharsets.UTF_8)));
        }

        return new ProducerRecord<>(
            message.getTopic(),
            message.getPartition(),
            message.getKey(),
            message.getPayload(),
            headers
        );
    }
}
