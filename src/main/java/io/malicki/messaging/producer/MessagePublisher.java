package io.malicki.messaging.producer;

import io.malicki.messaging.domain.message.PublishOptions;

public interface MessagePublisher {

    void publish(String topic, byte[] payload, PublishOptions options);
}
