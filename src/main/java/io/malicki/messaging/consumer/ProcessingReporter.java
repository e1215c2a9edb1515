package io.malicki.messaging.consumer;

/**
 * Observability seam of the consumption pipeline. Called on the processing
 * thread; implementations should return quickly.
 */
public interface ProcessingReporter {

    ProcessingReporter NONE = new ProcessingReporter() {
    };

    default void attemptFinished(AttemptReport report) {
    }

    default void processingFinished(ProcessingResult result) {
    }
}
