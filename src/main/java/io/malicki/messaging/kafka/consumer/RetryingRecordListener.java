package io.malicki.messaging.kafka.consumer;

import io.malicki.messaging.consumer.MessageHandler;
import io.malicki.messaging.consumer.OffsetCommitTracker;
import io.malicki.messaging.consumer.ProcessingReporter;
import io.malicki.messaging.consumer.ProcessingResult;
import io.malicki.messaging.consumer.RetryingMessageProcessor;
import io.malicki.messaging.domain.message.Envelope;
import io.malicki.messaging.retry.BackoffPolicy;
import io.malicki.messaging.retry.ShutdownSignal;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.listener.ConsumerAwareMessageListener;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.WeakHashMap;

/**
 * Listener container callback: converts each record and runs it through a
 * {@link RetryingMessageProcessor} that commits via the delivering consumer.
 *
 * <p>A concurrent container shares one listener between its child containers,
 * each polling with its own consumer, so there is one processor (and one
 * commit tracker) per consumer, reused for all of that consumer's records.
 */
@Slf4j
public class RetryingRecordListener implements ConsumerAwareMessageListener<String, byte[]> {

    private final MessageHandler handler;
    private final BackoffPolicy backoffPolicy;
    private final ProcessingReporter reporter;
    private final ShutdownSignal shutdownSignal;
    private final boolean disablePayloadLogging;
    // weak keys: a stopped container's consumer is released with its processor
    private final Map<Consumer<?, ?>, RetryingMessageProcessor> processors =
        Collections.synchronizedMap(new WeakHashMap<>());

    public RetryingRecordListener(
        MessageHandler handler,
        BackoffPolicy backoffPolicy,
        ProcessingReporter reporter,
        ShutdownSignal shutdownSignal,
        boolean disablePayloadLogging
    ) {
        this.handler = handler;
        this.backoffPolicy = backoffPolicy;
        this.reporter = reporter;
        this.shutdownSignal = shutdownSignal;
        this.disablePayloadLogging = disablePayloadLogging;
    }

    @Override
    public void onMessage(ConsumerRecord<String, byte[]> record, Consumer<?, ?> consumer) {
        if (disablePayloadLogging) {
            log.info("📨 Consuming | Topic: {} | Partition: {} | Offset: {}",
                    record.topic(), record.partition(), record.offset());
        } else {
            log.info("📨 Consuming | Topic: {} | Partition: {} | Offset: {} | Payload: {}",
                    record.topic(), record.partition(), record.offset(),
                    record.value() != null ? new String(record.value(), StandardCharsets.UTF_8) : null);
        }

        Envelope envelope = KafkaEnvelopes.from(record);
        ProcessingResult result = processorFor(consumer).process(envelope, handler);

        log.info("Consumed | Topic: {} | Partition: {} | Offset: {} | Outcome: {}",
                record.topic(), record.partition(), record.offset(), result.getOutcome());
    }

    private RetryingMessageProcessor processorFor(Consumer<?, ?> consumer) {
        return processors.computeIfAbsent(consumer, c -> new RetryingMessageProcessor(
            backoffPolicy,
            new OffsetCommitTracker(new KafkaOffsetCommitter(c)),
            reporter,
            shutdownSignal
        ));
    }

    int processorCount() {
        return processors.size();
    }
}
