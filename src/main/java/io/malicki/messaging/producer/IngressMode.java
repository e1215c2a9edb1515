package io.malicki.messaging.producer;

public enum IngressMode {

    /** {@code enqueue} waits until the loop has handed the message to the transport. */
    BLOCK,

    /** {@code enqueue} returns at once and fails when too many hand-offs are waiting. */
    FAIL_FAST
}
