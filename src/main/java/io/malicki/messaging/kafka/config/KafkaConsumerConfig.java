package io.malicki.messaging.kafka.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.malicki.messaging.consumer.CompositeProcessingReporter;
import io.malicki.messaging.consumer.ProcessingReporter;
import io.malicki.messaging.consumer.ProcessingStatistics;
import io.malicki.messaging.kafka.consumer.KafkaConsumerGroupFactory;
import io.malicki.messaging.kafka.errorhandling.DeadLetterTopicService;
import io.malicki.messaging.kafka.errorhandling.FailedMessage;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.JacksonUtils;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Configuration(proxyBeanMethods = false)
public class KafkaConsumerConfig {

    @Bean
    @ConditionalOnMissingBean(name = "messagingConsumerFactory")
    public ConsumerFactory<String, byte[]> messagingConsumerFactory(MessagingProperties properties) {
        MessagingProperties.ConsumerProperties consumer = properties.getConsumer();

        Map<String, Object> config = new HashMap<>();
        config.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.getBootstrapServers());
        config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);  // Committed by the pipeline
        config.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, consumer.isOffsetNewest() ? "latest" : "earliest");
        config.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        config.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        config.put(ConsumerConfig.CLIENT_ID_CONFIG, properties.clientId());
        config.put(ConsumerConfig.CLIENT_RACK_CONFIG, properties.getServer());
        config.put(ConsumerConfig.ALLOW_AUTO_CREATE_TOPICS_CONFIG, consumer.isAutoCreateTopics());
        // One record per poll; its retries must finish before the group evicts the member
        config.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 1);
        config.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, consumer.maxPollIntervalMs());
        config.putAll(properties.getProperties());
        config.putAll(consumer.getProperties());

        return new DefaultKafkaConsumerFactory<>(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessingStatistics processingStatistics() {
        return new ProcessingStatistics();
    }

    @Bean
    @ConditionalOnMissingBean
    public KafkaConsumerGroupFactory kafkaConsumerGroupFactory(
        ConsumerFactory<String, byte[]> messagingConsumerFactory,
        MessagingProperties properties,
        ObjectProvider<ProcessingReporter> reporters
    ) {
        List<ProcessingReporter> delegates = reporters.orderedStream().toList();
        return new KafkaConsumerGroupFactory(
            messagingConsumerFactory,
            properties,
            new CompositeProcessingReporter(delegates)
        );
    }

    // Copies of messages that exhausted their retries
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "messaging.consumer.dead-letter", name = "enabled", havingValue = "true")
    static class DeadLetterConfig {

        @Bean
        public ProducerFactory<String, FailedMessage> dltProducerFactory(
            MessagingProperties properties,
            ObjectProvider<ObjectMapper> objectMapper
        ) {
            Map<String, Object> config = new HashMap<>();
            config.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.getBootstrapServers());
            config.put(ProducerConfig.CLIENT_ID_CONFIG, properties.clientId() + ".dlt");
            config.put(ProducerConfig.ACKS_CONFIG, "all");
            config.put(ProducerConfig.RETRIES_CONFIG, 3);
            config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
            config.putAll(properties.getProperties());
            config.putAll(properties.getProducer().getProperties());

            // the application's ObjectMapper if it has one
            ObjectMapper mapper = objectMapper.getIfAvailable(JacksonUtils::enhancedObjectMapper);
            return new DefaultKafkaProducerFactory<>(config, new StringSerializer(), new JsonSerializer<>(mapper));
        }

        @Bean
        public KafkaTemplate<String, FailedMessage> dltKafkaTemplate(
            ProducerFactory<String, FailedMessage> dltProducerFactory
        ) {
            return new KafkaTemplate<>(dltProducerFactory);
        }

        @Bean
        @ConditionalOnMissingBean
        public DeadLetterTopicService deadLetterTopicService(
            KafkaTemplate<String, FailedMessage> dltKafkaTemplate,
            MessagingProperties properties
        ) {
            return new DeadLetterTopicService(
                dltKafkaTemplate,
                properties.groupId(),
                properties.getConsumer().getDeadLetter().getTopicSuffix(),
                Clock.systemUTC()
            );
        }
    }
}
