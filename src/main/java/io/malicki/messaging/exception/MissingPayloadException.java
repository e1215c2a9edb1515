package io.malicki.messaging.exception;

import lombok.Getter;

@Getter
public class MissingPayloadException extends IllegalArgumentException {

    private final String topic;

    public MissingPayloadException(String topic) {
        super("No payload provided for topic: " + topic);
        this.topic = topic;
    }

}
