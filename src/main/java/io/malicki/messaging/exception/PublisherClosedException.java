package io.malicki.messaging.exception;

public class PublisherClosedException extends IllegalStateException {

    public PublisherClosedException() {
        super("Publisher is closed");
    }

}
