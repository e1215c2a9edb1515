package io.malicki.messaging.domain.message;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder(toBuilder = true)
public class PublishOptions {

    private static final PublishOptions NONE = PublishOptions.builder().build();

    String key;
    Integer partition;  // null lets the partitioner decide
    @Singular
    Map<String, String> headers;
    boolean disablePayloadLogging;

    public static PublishOptions none() {
        return NONE;
    }

    public static PublishOptions withKey(String key) {
        return PublishOptions.builder().key(key).build();
    }
}
