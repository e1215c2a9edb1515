package io.malicki.messaging.consumer;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Fans reports out to several reporters. A failing reporter is logged and
 * does not prevent the others from running.
 */
@Slf4j
public class CompositeProcessingReporter implements ProcessingReporter {

    private final List<ProcessingReporter> delegates;

    public CompositeProcessingReporter(List<? extends ProcessingReporter> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void attemptFinished(AttemptReport report) {
        for (ProcessingReporter delegate : delegates) {
            try {
                delegate.attemptFinished(report);
            } catch (RuntimeException e) {
                log.warn("Reporter {} failed on attempt report for {}: {}",
                        delegate.getClass().getSimpleName(), report.getMessageId(), e.getMessage(), e);
            }
        }
    }

    @Override
    public void processingFinished(ProcessingResult result) {
        for (ProcessingReporter delegate : delegates) {
            try {
                delegate.processingFinished(result);
            } catch (RuntimeException e) {
                log.warn("Reporter {} failed on result for {}: {}",
                        delegate.getClass().getSimpleName(), result.getEnvelope().getId(), e.getMessage(), e);
            }
        }
    }
}
