package io.malicki.messaging.consumer;

public enum ProcessingOutcome {

    SUCCEEDED,

    // retries used up; the message is still committed so the partition moves on
    EXHAUSTED,

    // shutdown hit during a backoff wait; nothing committed
    CANCELLED
}
