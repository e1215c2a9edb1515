package io.malicki.messaging.consumer;

import io.malicki.messaging.domain.message.CommitRecord;
import io.malicki.messaging.domain.message.Envelope;
import io.malicki.messaging.domain.message.MessageId;
import io.malicki.messaging.exception.MessagingTransportException;
import io.malicki.messaging.retry.BackoffPolicy;
import io.malicki.messaging.retry.ShutdownSignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Partition Consumer Tests")
class PartitionConsumerTest {

    private final List<String> events = new ArrayList<>();

    @Test
    @DisplayName("Should commit each message before reading the next one")
    void testSequentialOrdering() {
        // Given: offset 11 fails once before succeeding
        Deque<Envelope> queue = new ArrayDeque<>(List.of(envelope(10), envelope(11), envelope(12)));
        MessageSource source = () -> {
            Envelope next = queue.poll();
            if (next != null) {
                events.add("receive " + next.getId().getOffset());
            }
            return Optional.ofNullable(next);
        };
        int[] failures = {1};
        MessageHandler handler = e -> {
            events.add("handle " + e.getId().getOffset());
            if (e.getId().getOffset() == 11 && failures[0]-- > 0) {
                throw new IllegalStateException("transient");
            }
        };
        ShutdownSignal signal = new ShutdownSignal();
        RetryingMessageProcessor processor = new RetryingMessageProcessor(
            immediate(), new OffsetCommitTracker(this::recordCommit), ProcessingReporter.NONE, signal);

        // When
        long handled = new PartitionConsumer(source, processor, handler, signal).run();

        // Then
        assertThat(handled).isEqualTo(3);
        assertThat(events).containsExactly(
            "receive 10", "handle 10", "commit 11",
            "receive 11", "handle 11", "handle 11", "commit 12",
            "receive 12", "handle 12", "commit 13");
    }

    @Test
    @DisplayName("Should stop reading once shutdown is signalled")
    void testStopsOnShutdown() {
        // Given: the handler fires the signal while processing the first message
        ShutdownSignal signal = new ShutdownSignal();
        Deque<Envelope> queue = new ArrayDeque<>(List.of(envelope(1), envelope(2)));
        RetryingMessageProcessor processor = new RetryingMessageProcessor(
            immediate(), new OffsetCommitTracker(this::recordCommit), ProcessingReporter.NONE, signal);

        // When
        long handled = new PartitionConsumer(
            () -> Optional.ofNullable(queue.poll()),
            processor,
            e -> signal.fire(),
            signal).run();

        // Then
        assertThat(handled).isEqualTo(1);
        assertThat(events).containsExactly("commit 2");
        assertThat(queue).hasSize(1);
    }

    @Test
    @DisplayName("Should propagate broker failures from the source")
    void testSourceFailurePropagates() {
        ShutdownSignal signal = new ShutdownSignal();
        RetryingMessageProcessor processor = new RetryingMessageProcessor(
            immediate(), new OffsetCommitTracker(this::recordCommit), ProcessingReporter.NONE, signal);

        assertThatThrownBy(() -> new PartitionConsumer(
            () -> {
                throw new MessagingTransportException("connection lost");
            },
            processor,
            e -> { },
            signal).run())
                .isInstanceOf(MessagingTransportException.class)
                .hasMessage("connection lost");
    }

    private void recordCommit(CommitRecord record) {
        events.add("commit " + record.getNextOffset());
    }

    private static Envelope envelope(long offset) {
        return Envelope.builder().id(MessageId.of("ledger", 0, offset, "")).build();
    }

    private static BackoffPolicy immediate() {
        return BackoffPolicy.builder()
            .initialInterval(Duration.ZERO)
            .maxInterval(Duration.ZERO)
            .maxAttempts(5)
            .build();
    }
}
