package io.malicki.messaging.kafka.config;

import io.malicki.messaging.retry.BackoffPolicy;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Kafka Consumer Config Tests")
class KafkaConsumerConfigTest {

    private final KafkaConsumerConfig config = new KafkaConsumerConfig();

    @Test
    @DisplayName("Should keep the member in the group for a whole default retry sequence")
    void testPollIntervalCoversDefaultRetries() {
        // Given
        MessagingProperties properties = new MessagingProperties();
        Duration retries = BackoffPolicy.defaults().worstCaseTotalDelay(Duration.ofDays(1));

        // When
        Map<String, Object> consumerConfig =
            config.messagingConsumerFactory(properties).getConfigurationProperties();

        // Then
        assertThat(consumerConfig).containsEntry(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 1);
        int pollInterval = (int) consumerConfig.get(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG);
        assertThat((long) pollInterval)
                .isGreaterThanOrEqualTo(retries.plus(Duration.ofMinutes(5)).toMillis())
                .isGreaterThan(BackoffPolicy.DEFAULT_MAX_INTERVAL.toMillis());
        assertThat(consumerConfig).containsEntry(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    }

    @Test
    @DisplayName("Should follow the configured retry budget and processing margin")
    void testPollIntervalFollowsRetrySettings() {
        // Given
        MessagingProperties properties = new MessagingProperties();
        MessagingProperties.Retry retry = properties.getConsumer().getRetry();
        retry.setInitialInterval(Duration.ofSeconds(10));
        retry.setMultiplier(2.0);
        retry.setMaxInterval(Duration.ofSeconds(30));
        retry.setMaxElapsedTime(Duration.ZERO);
        retry.setMaxAttempts(4);
        properties.getConsumer().setProcessingMargin(Duration.ofSeconds(40));

        // When
        Map<String, Object> consumerConfig =
            config.messagingConsumerFactory(properties).getConfigurationProperties();

        // Then
        assertThat(consumerConfig).containsEntry(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, 100_000);
    }

    @Test
    @DisplayName("Should cap the poll interval for policies without a time bound")
    void testPollIntervalCapped() {
        // Given
        MessagingProperties properties = new MessagingProperties();
        properties.getConsumer().getRetry().setMaxElapsedTime(Duration.ZERO);
        properties.getConsumer().getRetry().setMaxAttempts(Integer.MAX_VALUE);

        // When
        int pollInterval = properties.getConsumer().maxPollIntervalMs();

        // Then
        assertThat(pollInterval).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    @DisplayName("Should apply shared and consumer client properties over derived settings")
    void testClientPropertiesOverride() {
        // Given
        MessagingProperties properties = new MessagingProperties();
        properties.getProperties().put("security.protocol", "SSL");
        properties.getProperties().put("client.rack", "shared-rack");
        properties.getConsumer().getProperties().put("client.rack", "eu-1a");
        properties.getConsumer().getProperties().put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, "600000");

        // When
        Map<String, Object> consumerConfig =
            config.messagingConsumerFactory(properties).getConfigurationProperties();

        // Then
        assertThat(consumerConfig)
                .containsEntry("security.protocol", "SSL")
                .containsEntry(ConsumerConfig.CLIENT_RACK_CONFIG, "eu-1a")
                .containsEntry(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, "600000");
    }
}
