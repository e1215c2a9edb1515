package io.malicki.messaging.consumer;

import io.malicki.messaging.domain.message.Envelope;
import io.malicki.messaging.retry.ShutdownSignal;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Drives one partition: each message is processed and committed before the
 * next one is read.
 */
@Slf4j
public class PartitionConsumer {

    private final MessageSource source;
    private final RetryingMessageProcessor processor;
    private final MessageHandler handler;
    private final ShutdownSignal shutdownSignal;

    public PartitionConsumer(
        MessageSource source,
        RetryingMessageProcessor processor,
        MessageHandler handler,
        ShutdownSignal shutdownSignal
    ) {
        this.source = source;
        this.processor = processor;
        this.handler = handler;
        this.shutdownSignal = shutdownSignal;
    }

    /**
     * Consumes until the source runs dry or shutdown is signalled.
     * Transport failures propagate to the caller.
     *
     * @return number of messages handled
     */
    public long run() {
        long handled = 0;
        while (!shutdownSignal.isFired()) {
            Optional<Envelope> next = source.receive();
            if (next.isEmpty()) {
                log.info("Message source drained after {} messages", handled);
                break;
            }
            ProcessingResult result = processor.process(next.get(), handler);
            handled++;
            if (result.getOutcome() == ProcessingOutcome.CANCELLED) {
                break;
            }
        }
        return handled;
    }
}
