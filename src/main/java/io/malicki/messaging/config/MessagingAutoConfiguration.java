package io.malicki.messaging.config;

import io.malicki.messaging.api.ConsumerStatsController;
import io.malicki.messaging.consumer.ProcessingStatistics;
import io.malicki.messaging.kafka.config.KafkaConsumerConfig;
import io.malicki.messaging.kafka.config.KafkaProducerConfig;
import io.malicki.messaging.kafka.config.MessagingProperties;
import io.malicki.messaging.kafka.errorhandling.DeadLetterTopicService;
import io.malicki.messaging.producer.LoggingPublishObserver;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Wires the retrying consumer, the publishers and, in servlet applications,
 * the stats endpoint. Every bean backs off when the application defines its own.
 */
@AutoConfiguration(before = KafkaAutoConfiguration.class)
@EnableConfigurationProperties(MessagingProperties.class)
@Import({KafkaConsumerConfig.class, KafkaProducerConfig.class})
public class MessagingAutoConfiguration {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(name = "org.springframework.web.bind.annotation.RestController")
    static class StatsEndpointConfig {

        @Bean
        @ConditionalOnMissingBean
        public ConsumerStatsController consumerStatsController(
            ProcessingStatistics processingStatistics,
            ObjectProvider<DeadLetterTopicService> deadLetterService,
            ObjectProvider<LoggingPublishObserver> publishObserver
        ) {
            return new ConsumerStatsController(processingStatistics, deadLetterService, publishObserver);
        }
    }
}
