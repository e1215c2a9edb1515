package io.malicki.messaging.kafka.config;

import io.malicki.messaging.retry.BackoffPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Messaging Properties Tests")
class MessagingPropertiesTest {

    @Test
    @DisplayName("Should build a client id Kafka accepts")
    void testClientId() {
        MessagingProperties properties = new MessagingProperties();
        properties.setAppName("payments");
        properties.setServer("host:9000|blue");

        assertThat(properties.clientId()).isEqualTo("payments.host.9000.blue");
    }

    @Test
    @DisplayName("Should fall back to the app name for the consumer group")
    void testGroupIdFallback() {
        MessagingProperties properties = new MessagingProperties();
        properties.setAppName("payments");

        assertThat(properties.groupId()).isEqualTo("payments");

        properties.getConsumer().setGroupId("payments-audit");
        assertThat(properties.groupId()).isEqualTo("payments-audit");
    }

    @Test
    @DisplayName("Should default retries to the backoff policy defaults")
    void testRetryDefaults() {
        BackoffPolicy policy = new MessagingProperties().getConsumer().getRetry().toBackoffPolicy();

        assertThat(policy).isEqualTo(BackoffPolicy.defaults());
    }
}
