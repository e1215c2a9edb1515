package io.malicki.messaging.domain.message;

import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A validated message ready to be handed to a transport.
 */
@Value
public class OutgoingMessage {

    String topic;
    String key;
    Integer partition;
    byte[] payload;
    Map<String, String> headers;
    boolean disablePayloadLogging;

    @Builder
    public OutgoingMessage(
        String topic,
        String key,
        Integer partition,
        byte[] payload,
        Map<String, String> headers,
        boolean disablePayloadLogging
    ) {
        this.topic = topic;
        this.key = key;
        this.partition = partition;
        this.payload = payload;
        this.headers = headers != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(headers))
            : Collections.emptyMap();
        this.disablePayloadLogging = disablePayloadLogging;
    }

    public String header(String name) {
        return headers.get(name);
    }

    public String payloadAsString() {
        return payload != null ? new String(payload, StandardCharsets.UTF_8) : "";
    }
}
