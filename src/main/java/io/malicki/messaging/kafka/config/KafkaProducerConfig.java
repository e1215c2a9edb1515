package io.malicki.messaging.kafka.config;

import io.malicki.messaging.kafka.producer.KafkaAsyncTransport;
import io.malicki.messaging.kafka.producer.KafkaSyncPublisher;
import io.malicki.messaging.producer.AsyncMessagePublisher;
import io.malicki.messaging.producer.CorrelationIdExtractor;
import io.malicki.messaging.producer.LoggingPublishObserver;
import io.malicki.messaging.producer.OutgoingMessages;
import io.malicki.messaging.producer.PublishAcknowledgmentMatcher;
import io.malicki.messaging.producer.PublishSegment;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.RoundRobinPartitioner;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "messaging.producer", name = "enabled", havingValue = "true", matchIfMissing = true)
public class KafkaProducerConfig {

    @Bean
    @ConditionalOnMissingBean(name = "messagingProducerFactory")
    public ProducerFactory<String, byte[]> messagingProducerFactory(MessagingProperties properties) {
        MessagingProperties.ProducerProperties producer = properties.getProducer();

        Map<String, Object> config = new HashMap<>();
        config.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.getBootstrapServers());
        config.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        config.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
        config.put(ProducerConfig.CLIENT_ID_CONFIG, properties.clientId());
        config.put(ProducerConfig.ACKS_CONFIG, producer.getAcks().value());
        config.put(ProducerConfig.RETRIES_CONFIG, 3);
        // Idempotence requires acks=all
        config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, producer.getAcks() == MessagingProperties.Acks.IN_SYNC);
        config.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, producer.getCompression());
        config.put(ProducerConfig.LINGER_MS_CONFIG, (int) producer.getFlushFrequency().toMillis());
        if (producer.isRoundRobinPartitioner()) {
            config.put(ProducerConfig.PARTITIONER_CLASS_CONFIG, RoundRobinPartitioner.class);
        }
        config.putAll(properties.getProperties());
        config.putAll(producer.getProperties());

        return new DefaultKafkaProducerFactory<>(config);
    }

    @Bean
    @ConditionalOnMissingBean(name = "messagingKafkaTemplate")
    public KafkaTemplate<String, byte[]> messagingKafkaTemplate(ProducerFactory<String, byte[]> messagingProducerFactory) {
        return new KafkaTemplate<>(messagingProducerFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public OutgoingMessages outgoingMessages() {
        return new OutgoingMessages();
    }

    @Bean
    @ConditionalOnMissingBean
    public LoggingPublishObserver loggingPublishObserver() {
        return new LoggingPublishObserver(Clock.systemUTC());
    }

    @Bean(destroyMethod = "close")
    @Primary
    @ConditionalOnMissingBean
    public AsyncMessagePublisher asyncMessagePublisher(
        KafkaTemplate<String, byte[]> messagingKafkaTemplate,
        OutgoingMessages outgoingMessages,
        LoggingPublishObserver loggingPublishObserver,
        MessagingProperties properties
    ) {
        MessagingProperties.ProducerProperties producer = properties.getProducer();

        PublishAcknowledgmentMatcher<PublishSegment> matcher = PublishAcknowledgmentMatcher.<PublishSegment>builder()
            .transport(new KafkaAsyncTransport(messagingKafkaTemplate))
            .correlationIdExtractor(CorrelationIdExtractor.fromHeader())
            .observer(loggingPublishObserver)
            .clock(Clock.systemUTC())
            .ingressMode(producer.getIngressMode())
            .ingressCapacity(producer.getIngressCapacity())
            .pendingTtl(producer.getPendingTtl())
            .build();

        return new AsyncMessagePublisher(matcher, outgoingMessages).start();
    }

    @Bean
    @ConditionalOnMissingBean
    public KafkaSyncPublisher kafkaSyncPublisher(
        KafkaTemplate<String, byte[]> messagingKafkaTemplate,
        OutgoingMessages outgoingMessages,
        MessagingProperties properties
    ) {
        return new KafkaSyncPublisher(
            messagingKafkaTemplate,
            outgoingMessages,
            properties.getProducer().getSyncSendTimeout()
        );
    }
}
