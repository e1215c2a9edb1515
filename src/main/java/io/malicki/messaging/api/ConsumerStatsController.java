package io.malicki.messaging.api;

import io.malicki.messaging.consumer.ProcessingOutcome;
import io.malicki.messaging.consumer.ProcessingStatistics;
import io.malicki.messaging.kafka.errorhandling.DeadLetterTopicService;
import io.malicki.messaging.producer.LoggingPublishObserver;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/messaging")
public class ConsumerStatsController {

    static final long EXHAUSTED_THRESHOLD = 100;

    private final ProcessingStatistics statistics;
    private final ObjectProvider<DeadLetterTopicService> deadLetterService;
    private final ObjectProvider<LoggingPublishObserver> publishObserver;

    public ConsumerStatsController(
        ProcessingStatistics statistics,
        ObjectProvider<DeadLetterTopicService> deadLetterService,
        ObjectProvider<LoggingPublishObserver> publishObserver
    ) {
        this.statistics = statistics;
        this.deadLetterService = deadLetterService;
        this.publishObserver = publishObserver;
    }

    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();

        stats.put("attempts", statistics.getAttempts());
        stats.put("failedAttempts", statistics.getFailedAttempts());

        // By outcome
        Map<ProcessingOutcome, Long> byOutcome = new EnumMap<>(ProcessingOutcome.class);
        for (ProcessingOutcome outcome : ProcessingOutcome.values()) {
            byOutcome.put(outcome, statistics.getCount(outcome));
        }
        stats.put("byOutcome", byOutcome);

        // Exhausted, by topic
        stats.put("exhaustedByTopic", statistics.getExhaustedCountByTopic());

        DeadLetterTopicService dlt = deadLetterService.getIfAvailable();
        if (dlt != null) {
            stats.put("totalSentToDlt", dlt.getDeadLetterCount());
        }

        LoggingPublishObserver observer = publishObserver.getIfAvailable();
        if (observer != null) {
            Map<String, Long> published = new HashMap<>();
            published.put("acknowledged", observer.getAcknowledgedCount());
            published.put("failed", observer.getFailedCount());
            published.put("unmatched", observer.getUnmatchedCount());
            stats.put("published", published);
        }

        return stats;
    }

    @GetMapping("/health")
    public Map<String, Object> getHealth() {
        Map<String, Object> health = new HashMap<>();

        long exhausted = statistics.getExhaustedTotal();

        health.put("status", exhausted < EXHAUSTED_THRESHOLD ? "HEALTHY" : "WARNING");
        health.put("totalExhaustedMessages", exhausted);
        health.put("threshold", EXHAUSTED_THRESHOLD);

        if (exhausted >= EXHAUSTED_THRESHOLD) {
            health.put("alert", "High number of messages given up after retries - investigation required!");
        }

        return health;
    }
}
