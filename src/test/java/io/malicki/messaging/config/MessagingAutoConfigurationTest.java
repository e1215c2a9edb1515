package io.malicki.messaging.config;

import io.malicki.messaging.api.ConsumerStatsController;
import io.malicki.messaging.consumer.ProcessingStatistics;
import io.malicki.messaging.kafka.config.MessagingProperties;
import io.malicki.messaging.kafka.consumer.KafkaConsumerGroupFactory;
import io.malicki.messaging.kafka.errorhandling.DeadLetterTopicService;
import io.malicki.messaging.kafka.producer.KafkaSyncPublisher;
import io.malicki.messaging.producer.AsyncMessagePublisher;
import io.malicki.messaging.producer.IngressMode;
import io.malicki.messaging.producer.MessagePublisher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.ProducerFactory;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Messaging Auto-Configuration Tests")
class MessagingAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(MessagingAutoConfiguration.class));

    @Test
    @DisplayName("Should register consumer and publisher beans with defaults")
    void testDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(MessagingProperties.class);
            assertThat(context).hasSingleBean(KafkaConsumerGroupFactory.class);
            assertThat(context).hasSingleBean(ProcessingStatistics.class);
            assertThat(context).hasSingleBean(AsyncMessagePublisher.class);
            assertThat(context).hasSingleBean(KafkaSyncPublisher.class);
            assertThat(context).doesNotHaveBean(DeadLetterTopicService.class);
            assertThat(context).doesNotHaveBean(ConsumerStatsController.class);

            assertThat(context.getBean(MessagePublisher.class)).isSameAs(context.getBean(AsyncMessagePublisher.class));
            assertThat(context.getBean(AsyncMessagePublisher.class).isRunning()).isTrue();
        });
    }

    @Test
    @DisplayName("Should bind messaging properties")
    void testPropertyBinding() {
        contextRunner
            .withPropertyValues(
                "messaging.app-name=payments",
                "messaging.server=eu:1",
                "messaging.consumer.concurrency=4",
                "messaging.consumer.retry.max-attempts=5",
                "messaging.consumer.retry.initial-interval=2s",
                "messaging.producer.ingress-mode=fail-fast",
                "messaging.producer.acks=local",
                "messaging.producer.pending-ttl=10m")
            .run(context -> {
                MessagingProperties properties = context.getBean(MessagingProperties.class);
                assertThat(properties.clientId()).isEqualTo("payments.eu.1");
                assertThat(properties.groupId()).isEqualTo("payments");
                assertThat(properties.getConsumer().getConcurrency()).isEqualTo(4);
                assertThat(properties.getConsumer().getRetry().toBackoffPolicy().getMaxAttempts()).isEqualTo(5);
                assertThat(properties.getConsumer().getRetry().getInitialInterval()).isEqualTo(Duration.ofSeconds(2));
                assertThat(properties.getProducer().getIngressMode()).isEqualTo(IngressMode.FAIL_FAST);
                assertThat(properties.getProducer().getAcks()).isEqualTo(MessagingProperties.Acks.LOCAL);
                assertThat(properties.getProducer().getPendingTtl()).isEqualTo(Duration.ofMinutes(10));
            });
    }

    @Test
    @DisplayName("Should fail on invalid settings")
    void testValidation() {
        contextRunner
            .withPropertyValues("messaging.consumer.concurrency=0")
            .run(context -> assertThat(context).hasFailed());
        contextRunner
            .withPropertyValues("messaging.producer.compression=brotli")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("Should add the dead letter reporter when enabled")
    void testDeadLetterEnabled() {
        contextRunner
            .withPropertyValues("messaging.consumer.dead-letter.enabled=true")
            .run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context).hasSingleBean(DeadLetterTopicService.class);
            });
    }

    @Test
    @DisplayName("Should pass raw client properties to every Kafka client")
    void testClientProperties() {
        contextRunner
            .withPropertyValues(
                "messaging.properties.security.protocol=SSL",
                "messaging.properties.ssl.truststore.location=/etc/kafka/truststore.jks",
                "messaging.consumer.properties.fetch.min.bytes=1024",
                "messaging.producer.properties.batch.size=32768",
                "messaging.consumer.dead-letter.enabled=true")
            .run(context -> {
                assertThat(context).hasNotFailed();
                ConsumerFactory<?, ?> consumerFactory = context.getBean("messagingConsumerFactory", ConsumerFactory.class);
                ProducerFactory<?, ?> producerFactory = context.getBean("messagingProducerFactory", ProducerFactory.class);
                ProducerFactory<?, ?> dltProducerFactory = context.getBean("dltProducerFactory", ProducerFactory.class);

                assertThat(consumerFactory.getConfigurationProperties())
                    .containsEntry("security.protocol", "SSL")
                    .containsEntry("ssl.truststore.location", "/etc/kafka/truststore.jks")
                    .containsEntry("fetch.min.bytes", "1024")
                    .doesNotContainKey("batch.size");
                assertThat(producerFactory.getConfigurationProperties())
                    .containsEntry("security.protocol", "SSL")
                    .containsEntry("batch.size", "32768")
                    .doesNotContainKey("fetch.min.bytes");
                assertThat(dltProducerFactory.getConfigurationProperties())
                    .containsEntry("security.protocol", "SSL")
                    .containsEntry("batch.size", "32768");
            });
    }

    @Test
    @DisplayName("Should skip publishers when the producer is disabled")
    void testProducerDisabled() {
        contextRunner
            .withPropertyValues("messaging.producer.enabled=false")
            .run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context).doesNotHaveBean(AsyncMessagePublisher.class);
                assertThat(context).doesNotHaveBean(KafkaSyncPublisher.class);
                assertThat(context).hasSingleBean(KafkaConsumerGroupFactory.class);
            });
    }

    @Test
    @DisplayName("Should expose the stats endpoint in servlet applications")
    void testStatsEndpoint() {
        new WebApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(MessagingAutoConfiguration.class))
            .run(context -> assertThat(context).hasSingleBean(ConsumerStatsController.class));
    }
}
