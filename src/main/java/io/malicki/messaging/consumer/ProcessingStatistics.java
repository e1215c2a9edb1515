package io.malicki.messaging.consumer;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory counters fed by the pipeline's reporting hook.
 */
@Slf4j
public class ProcessingStatistics implements ProcessingReporter {

    private final AtomicLong attempts = new AtomicLong();
    private final AtomicLong failedAttempts = new AtomicLong();
    private final Map<ProcessingOutcome, AtomicLong> countByOutcome = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> exhaustedCountByTopic = new ConcurrentHashMap<>();

    @Override
    public void attemptFinished(AttemptReport report) {
        attempts.incrementAndGet();
        if (!report.isSuccess()) {
            failedAttempts.incrementAndGet();
        }
    }

    @Override
    public void processingFinished(ProcessingResult result) {
        countByOutcome.computeIfAbsent(result.getOutcome(), k -> new AtomicLong(0)).incrementAndGet();

        if (result.getOutcome() == ProcessingOutcome.EXHAUSTED) {
            long total = exhaustedCountByTopic.computeIfAbsent(
                result.getEnvelope().getId().getTopic(),
                k -> new AtomicLong(0)
            ).incrementAndGet();
            log.info("📊 [STATS] Exhausted messages on {}: {}", result.getEnvelope().getId().getTopic(), total);
        }
    }

    public long getAttempts() {
        return attempts.get();
    }

    public long getFailedAttempts() {
        return failedAttempts.get();
    }

    public long getCount(ProcessingOutcome outcome) {
        AtomicLong count = countByOutcome.get(outcome);
        return count != null ? count.get() : 0;
    }

    public long getExhaustedTotal() {
        return getCount(ProcessingOutcome.EXHAUSTED);
    }

    public Map<String, Long> getExhaustedCountByTopic() {
        return exhaustedCountByTopic.entrySet()
            .stream()
            .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().get()));
    }
}
