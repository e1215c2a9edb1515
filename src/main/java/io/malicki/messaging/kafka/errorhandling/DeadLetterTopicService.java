package io.malicki.messaging.kafka.errorhandling;

import io.malicki.messaging.consumer.ProcessingOutcome;
import io.malicki.messaging.consumer.ProcessingReporter;
import io.malicki.messaging.consumer.ProcessingResult;
import io.malicki.messaging.domain.message.Envelope;
import io.malicki.messaging.domain.message.MessageId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.util.HashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Copies messages whose retries were exhausted to {@code <topic><suffix>}.
 * The original message is still committed by the pipeline; this is a record
 * for later inspection, not a redelivery path.
 */
@Slf4j
public class DeadLetterTopicService implements ProcessingReporter {

    private final KafkaTemplate<String, FailedMessage> deadLetterKafkaTemplate;
    private final String consumerGroupId;
    private final String topicSuffix;
    private final Clock clock;
    private final AtomicLong deadLetterCount = new AtomicLong(0);

    public DeadLetterTopicService(
        KafkaTemplate<String, FailedMessage> deadLetterKafkaTemplate,
        String consumerGroupId,
        String topicSuffix,
        Clock clock
    ) {
        this.deadLetterKafkaTemplate = deadLetterKafkaTemplate;
        this.consumerGroupId = consumerGroupId;
        this.topicSuffix = topicSuffix;
        this.clock = clock;
    }

    @Override
    public void processingFinished(ProcessingResult result) {
        if (result.getOutcome() == ProcessingOutcome.EXHAUSTED) {
            sendToDeadLetterTopic(result);
        }
    }

    public void sendToDeadLetterTopic(ProcessingResult result) {
        MessageId id = result.getEnvelope().getId();
        String deadLetterTopic = id.getTopic() + topicSuffix;

        try {
            FailedMessage failedMessage = buildFailedMessage(result);

            deadLetterKafkaTemplate.send(deadLetterTopic, failedMessage.getOriginalKey(), failedMessage)
                .whenComplete((sendResult, ex) -> {
                    if (ex != null) {
                        log.error("❌ Failed to send message to DLT {}: {}",
                                deadLetterTopic, ex.getMessage(), ex);
                    } else {
                        long count = deadLetterCount.incrementAndGet();
                        log.warn("📮 Message sent to DLT: {} | Original Topic: {} | Offset: {} | Attempts: {} | Total DLT: {}",
                                deadLetterTopic,
                                id.getTopic(),
                                id.getOffset(),
                                result.getAttempts(),
                                count);
                    }
                });

        } catch (RuntimeException e) {
            log.error("💥 Failed to send to DLT, copy of {} lost", id, e);
        }
    }

    private FailedMessage buildFailedMessage(ProcessingResult result) {
        Envelope envelope = result.getEnvelope();
        MessageId id = envelope.getId();
        Exception error = result.getFinalError();

        FailedMessage failedMessage = new FailedMessage();
        failedMessage.setOriginalTopic(id.getTopic());
        failedMessage.setOriginalPartition(id.getPartition());
        failedMessage.setOriginalOffset(id.getOffset());
        failedMessage.setOriginalKey(id.getKey().isEmpty() ? null : id.getKey());
        failedMessage.setOriginalValue(envelope.payloadAsString());

        if (error != null) {
            failedMessage.setExceptionType(error.getClass().getName());
            failedMessage.setExceptionMessage(error.getMessage());
            failedMessage.setStackTrace(getStackTraceAsString(error));
        }
        failedMessage.setAttemptCount(result.getAttempts());

        failedMessage.setFailedAt(clock.instant());
        failedMessage.setConsumerGroupId(consumerGroupId);
        failedMessage.setHeaders(new HashMap<>(envelope.getHeaders()));

        return failedMessage;
    }

    private String getStackTraceAsString(Exception e) {
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        e.printStackTrace(pw);
        return sw.toString();
    }

    public long getDeadLetterCount() {
        return deadLetterCount.get();
    }
}
