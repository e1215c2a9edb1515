package io.malicki.messaging.api;

import io.malicki.messaging.consumer.ProcessingOutcome;
import io.malicki.messaging.consumer.ProcessingResult;
import io.malicki.messaging.consumer.ProcessingStatistics;
import io.malicki.messaging.domain.message.CommitRecord;
import io.malicki.messaging.domain.message.Envelope;
import io.malicki.messaging.domain.message.MessageId;
import io.malicki.messaging.kafka.errorhandling.DeadLetterTopicService;
import io.malicki.messaging.producer.LoggingPublishObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("Consumer Stats Controller Tests")
class ConsumerStatsControllerTest {

    private ProcessingStatistics statistics;
    private ConsumerStatsController controller;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        statistics = new ProcessingStatistics();
        ObjectProvider<DeadLetterTopicService> deadLetter = mock(ObjectProvider.class);
        ObjectProvider<LoggingPublishObserver> observer = mock(ObjectProvider.class);
        when(observer.getIfAvailable()).thenReturn(new LoggingPublishObserver(Clock.systemUTC()));
        controller = new ConsumerStatsController(statistics, deadLetter, observer);
    }

    @Test
    @DisplayName("Should report counts by outcome and topic")
    @SuppressWarnings("unchecked")
    void testStats() {
        // Given
        statistics.processingFinished(result("transfers", ProcessingOutcome.EXHAUSTED));
        statistics.processingFinished(result("transfers", ProcessingOutcome.SUCCEEDED));

        // When
        Map<String, Object> stats = controller.getStats();

        // Then
        assertThat((Map<ProcessingOutcome, Long>) stats.get("byOutcome"))
                .containsEntry(ProcessingOutcome.EXHAUSTED, 1L)
                .containsEntry(ProcessingOutcome.SUCCEEDED, 1L)
                .containsEntry(ProcessingOutcome.CANCELLED, 0L);
        assertThat((Map<String, Long>) stats.get("exhaustedByTopic")).containsEntry("transfers", 1L);
        assertThat(stats).doesNotContainKey("totalSentToDlt");
        assertThat(stats).containsKey("published");
    }

    @Test
    @DisplayName("Should turn to WARNING at the exhausted threshold")
    void testHealthThreshold() throws Exception {
        // Given
        MockMvc mockMvc = MockMvcBuilders.standaloneSetup(controller).build();

        // When & Then: healthy below threshold
        mockMvc.perform(get("/api/messaging/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("HEALTHY"));

        for (int i = 0; i < ConsumerStatsController.EXHAUSTED_THRESHOLD; i++) {
            statistics.processingFinished(result("transfers", ProcessingOutcome.EXHAUSTED));
        }

        mockMvc.perform(get("/api/messaging/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("WARNING"))
                .andExpect(jsonPath("$.totalExhaustedMessages").value(100))
                .andExpect(jsonPath("$.alert").exists());
    }

    private static ProcessingResult result(String topic, ProcessingOutcome outcome) {
        MessageId id = MessageId.of(topic, 0, 1, "");
        return new ProcessingResult(Envelope.builder().id(id).build(), 1,
            outcome == ProcessingOutcome.SUCCEEDED ? null : new IllegalStateException("x"),
            outcome, CommitRecord.after(id));
    }
}
