package io.malicki.messaging.producer;

import io.malicki.messaging.domain.message.DeliveryPosition;
import io.malicki.messaging.domain.message.OutgoingMessage;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
public class LoggingPublishObserver implements PublishObserver<PublishSegment> {

    private final Clock clock;
    private final AtomicLong acknowledged = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong unmatched = new AtomicLong();

    public LoggingPublishObserver(Clock clock) {
        this.clock = clock;
    }

    @Override
    public PublishSegment onHandedOff(OutgoingMessage message) {
        log.info("📤 Publish message | Topic: {} | Key: {}", message.getTopic(), message.getKey());
        return new PublishSegment(message.getTopic(), message.getKey(), clock.instant());
    }

    @Override
    public void onAcknowledged(PendingPublishEntry<PublishSegment> entry, DeliveryPosition position) {
        acknowledged.incrementAndGet();
        PublishSegment segment = segmentOf(entry);
        log.info("✅ Send success | {} | Key: {} | Correlation: {} | Took: {}ms",
                segment.describe(position),
                segment.getKey(),
                entry.getCorrelationId(),
                segment.elapsed(clock.instant()).toMillis());
    }

    @Override
    public void onFailed(PendingPublishEntry<PublishSegment> entry, Exception error) {
        failed.incrementAndGet();
        PublishSegment segment = segmentOf(entry);
        log.error("❌ Send error | Topic: {} | Key: {} | Correlation: {} | Took: {}ms",
                segment.getTopic(),
                segment.getKey(),
                entry.getCorrelationId(),
                segment.elapsed(clock.instant()).toMillis(),
                error);
    }

    @Override
    public void onUnmatched(OutgoingMessage message, DeliveryPosition position, Exception error) {
        unmatched.incrementAndGet();
        log.warn("⚠️ Outcome for unknown publish | Topic: {} | Key: {} | Error: {}",
                message.getTopic(), message.getKey(), error != null ? error.getMessage() : "none");
    }

    @Override
    public void onExpired(PendingPublishEntry<PublishSegment> entry) {
        log.warn("⌛ Pending publish expired without outcome | Topic: {} | Correlation: {} | Enqueued: {}",
                entry.getMessage().getTopic(), entry.getCorrelationId(), entry.getEnqueuedAt());
    }

    // No context when onHandedOff threw; time from when the entry was queued instead
    private static PublishSegment segmentOf(PendingPublishEntry<PublishSegment> entry) {
        if (entry.getContext() != null) {
            return entry.getContext();
        }
        OutgoingMessage message = entry.getMessage();
        return new PublishSegment(message.getTopic(), message.getKey(), entry.getEnqueuedAt());
    }

    public long getAcknowledgedCount() {
        return acknowledged.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    public long getUnmatchedCount() {
        return unmatched.get();
    }
}
