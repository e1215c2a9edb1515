package io.malicki.messaging.exception;

import lombok.Getter;

@Getter
public class PublishQueueFullException extends IllegalStateException {

    private final int capacity;

    public PublishQueueFullException(int capacity) {
        super(String.format("Publish queue is full (capacity: %d)", capacity));
        this.capacity = capacity;
    }

}
