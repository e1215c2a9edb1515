package io.malicki.messaging.consumer;

import io.malicki.messaging.domain.message.CommitRecord;
import io.malicki.messaging.domain.message.Envelope;
import io.malicki.messaging.domain.message.MessageId;
import io.malicki.messaging.exception.HandlerPanicException;
import io.malicki.messaging.retry.BackoffPolicy;
import io.malicki.messaging.retry.BackoffStep;
import io.malicki.messaging.retry.ShutdownSignal;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Runs a handler against one message with bounded retries, then commits.
 *
 * <p>A message that keeps failing is committed once its retries are exhausted
 * so it never blocks the rest of its partition. A shutdown during a backoff
 * wait abandons the message without committing it.
 *
 * <p>Callers must not process two messages of the same partition concurrently.
 */
@Slf4j
public class RetryingMessageProcessor {

    private final BackoffPolicy backoffPolicy;
    private final OffsetCommitTracker commitTracker;
    private final ProcessingReporter reporter;
    private final ShutdownSignal shutdownSignal;

    public RetryingMessageProcessor(
        BackoffPolicy backoffPolicy,
        OffsetCommitTracker commitTracker,
        ProcessingReporter reporter,
        ShutdownSignal shutdownSignal
    ) {
        this.backoffPolicy = backoffPolicy;
        this.commitTracker = commitTracker;
        this.reporter = reporter != null ? reporter : ProcessingReporter.NONE;
        this.shutdownSignal = shutdownSignal;
    }

    public ProcessingResult process(Envelope envelope, MessageHandler handler) {
        MessageId id = envelope.getId();
        int attempts = 0;
        Exception lastError;
        ProcessingOutcome outcome;

        while (true) {
            attempts++;
            log.info("🔄 Processing attempt {} | Topic: {} | Partition: {} | Offset: {}",
                    attempts, id.getTopic(), id.getPartition(), id.getOffset());

            lastError = invoke(handler, envelope);
            if (lastError == null) {
                report(new AttemptReport(id, attempts, null, null));
                outcome = ProcessingOutcome.SUCCEEDED;
                break;
            }

            BackoffStep step = backoffPolicy.nextDelay(attempts);
            Duration nextDelay = step.isExhausted() ? null : step.getDelay();
            report(new AttemptReport(id, attempts, lastError, nextDelay));

            if (step.isExhausted()) {
                log.warn("⚠️ Giving up | Topic: {} | Partition: {} | Offset: {} | Attempts: {} | Will commit and move on",
                        id.getTopic(), id.getPartition(), id.getOffset(), attempts);
                outcome = ProcessingOutcome.EXHAUSTED;
                break;
            }

            log.info("⏳ Will retry | Attempt: {}/{} | Delay: {}ms | Offset: {}",
                    attempts + 1, backoffPolicy.getMaxAttempts(), nextDelay.toMillis(), id.getOffset());

            if (shutdownSignal.await(nextDelay)) {
                log.warn("🛑 Shutdown during backoff | Topic: {} | Partition: {} | Offset: {} | Attempts: {} | Not committing",
                        id.getTopic(), id.getPartition(), id.getOffset(), attempts);
                outcome = ProcessingOutcome.CANCELLED;
                break;
            }
        }

        CommitRecord commit = null;
        if (outcome != ProcessingOutcome.CANCELLED) {
            commit = commitTracker.commitPosition(id);
        }

        ProcessingResult result = new ProcessingResult(
            envelope,
            attempts,
            outcome == ProcessingOutcome.SUCCEEDED ? null : lastError,
            outcome,
            commit
        );
        finish(result);

        log.info("✅ Processed | Topic: {} | Partition: {} | Offset: {} | Outcome: {} | Attempts: {}",
                id.getTopic(), id.getPartition(), id.getOffset(), outcome, attempts);
        return result;
    }

    private Exception invoke(MessageHandler handler, Envelope envelope) {
        try {
            handler.handle(envelope);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("❌ Handler interrupted | Message: {}", envelope.getId());
            return e;
        } catch (Exception e) {
            log.error("❌ Handler failed | Message: {} | Error: {}", envelope.getId(), e.getMessage());
            return e;
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Error e) {
            log.error("💥 Caught handler panic | Message: {}", envelope.getId(), e);
            return new HandlerPanicException(envelope.getId(), e);
        }
    }

    private void report(AttemptReport report) {
        try {
            reporter.attemptFinished(report);
        } catch (RuntimeException e) {
            log.warn("Reporter failed on attempt {} of {}: {}",
                    report.getAttempt(), report.getMessageId(), e.getMessage(), e);
        }
    }

    private void finish(ProcessingResult result) {
        try {
            reporter.processingFinished(result);
        } catch (RuntimeException e) {
            log.warn("Reporter failed on result of {}: {}",
                    result.getEnvelope().getId(), e.getMessage(), e);
        }
    }
}
