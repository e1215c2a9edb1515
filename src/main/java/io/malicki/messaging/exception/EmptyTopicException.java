package io.malicki.messaging.exception;

public class EmptyTopicException extends IllegalArgumentException {

    public EmptyTopicException() {
        super("Topic is empty");
    }

}
