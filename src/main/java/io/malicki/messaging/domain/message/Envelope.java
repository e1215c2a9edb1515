package io.malicki.messaging.domain.message;

import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized inbound message. Owned by the pipeline invocation that read it.
 */
@Value
public class Envelope {

    MessageId id;
    byte[] payload;
    Map<String, String> headers;

    @Builder
    public Envelope(MessageId id, byte[] payload, Map<String, String> headers) {
        if (id == null) {
            throw new IllegalArgumentException("Message id is required");
        }
        this.id = id;
        this.payload = payload != null ? payload : new byte[0];
        this.headers = headers != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(headers))
            : Collections.emptyMap();
    }

    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    public String header(String name) {
        return headers.get(name);
    }
}
