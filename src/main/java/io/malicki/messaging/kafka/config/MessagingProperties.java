package io.malicki.messaging.kafka.config;

import io.malicki.messaging.producer.IngressMode;
import io.malicki.messaging.retry.BackoffPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Settings bound from {@code messaging.*}.
 *
 * <pre>
 * messaging:
 *   app-name: payments
 *   server: eu-1
 *   bootstrap-servers: localhost:9092
 *   consumer:
 *     retry:
 *       max-attempts: 5
 *   producer:
 *     acks: in-sync
 *   properties:
 *     security.protocol: SSL
 *     ssl.truststore.location: /etc/kafka/truststore.jks
 * </pre>
 *
 * <p>Entries under {@code properties} go to every Kafka client the library
 * creates; {@code consumer.properties} and {@code producer.properties} go to
 * one side only and win over the shared ones. They are applied last, so they
 * also override the settings derived here.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "messaging")
public class MessagingProperties {

    @NotBlank
    private String appName = "messaging";

    @NotBlank
    private String server = "local";

    @NotBlank
    private String bootstrapServers = "localhost:9092";

    @Valid
    private ConsumerProperties consumer = new ConsumerProperties();

    @Valid
    private ProducerProperties producer = new ProducerProperties();

    // raw Kafka client settings (TLS, SASL, ...) shared by consumers and producers
    private Map<String, String> properties = new HashMap<>();

    /**
     * Kafka client id: {@code appName.server} with characters Kafka metrics
     * reject replaced by dots.
     */
    public String clientId() {
        return (appName + "." + server).replace(':', '.').replace('|', '.');
    }

    public String groupId() {
        String groupId = consumer.getGroupId();
        return groupId == null || groupId.isBlank() ? appName : groupId;
    }

    @Data
    public static class ConsumerProperties {
        // falls back to app-name
        private String groupId;

        @Min(1)
        private int concurrency = 1;

        // start from the newest offset when the group has none committed
        private boolean offsetNewest = false;

        private boolean autoCreateTopics = false;

        private boolean disablePayloadLogging = false;

        @Valid
        private Retry retry = new Retry();

        @Valid
        private DeadLetter deadLetter = new DeadLetter();

        // handler time allowed on top of the backoff waits of one record
        @NotNull
        private Duration processingMargin = Duration.ofMinutes(5);

        private Map<String, String> properties = new HashMap<>();

        /**
         * {@code max.poll.interval.ms} for one-record polls. A record's whole
         * retry sequence runs before the next poll, so the interval covers the
         * policy's worst-case waits plus {@link #processingMargin}.
         */
        public int maxPollIntervalMs() {
            Duration limit = Duration.ofMillis(Integer.MAX_VALUE);
            Duration interval = retry.toBackoffPolicy().worstCaseTotalDelay(limit).plus(processingMargin);
            return (int) Math.min(interval.toMillis(), Integer.MAX_VALUE);
        }
    }

    @Data
    public static class Retry {
        @NotNull
        private Duration initialInterval = BackoffPolicy.DEFAULT_INITIAL_INTERVAL;

        @DecimalMin("1.0")
        private double multiplier = BackoffPolicy.DEFAULT_MULTIPLIER;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double randomizationFactor = BackoffPolicy.DEFAULT_RANDOMIZATION_FACTOR;

        @NotNull
        private Duration maxInterval = BackoffPolicy.DEFAULT_MAX_INTERVAL;

        @NotNull
        private Duration maxElapsedTime = BackoffPolicy.DEFAULT_MAX_ELAPSED_TIME;

        @Min(1)
        private int maxAttempts = BackoffPolicy.DEFAULT_MAX_ATTEMPTS;

        public BackoffPolicy toBackoffPolicy() {
            return BackoffPolicy.builder()
                .initialInterval(initialInterval)
                .multiplier(multiplier)
                .randomizationFactor(randomizationFactor)
                .maxInterval(maxInterval)
                .maxElapsedTime(maxElapsedTime)
                .maxAttempts(maxAttempts)
                .build();
        }
    }

    @Data
    public static class DeadLetter {
        private boolean enabled = false;

        @NotBlank
        private String topicSuffix = "-dlt";
    }

    @Data
    public static class ProducerProperties {
        private boolean enabled = true;

        @NotNull
        private Acks acks = Acks.IN_SYNC;

        @Pattern(regexp = "none|gzip|snappy|lz4|zstd")
        private String compression = "none";

        private boolean roundRobinPartitioner = false;

        // linger.ms; ZERO sends as soon as possible
        @NotNull
        private Duration flushFrequency = Duration.ZERO;

        @NotNull
        private IngressMode ingressMode = IngressMode.BLOCK;

        @Min(1)
        private int ingressCapacity = 64;

        // unset: pending publishes wait for their acknowledgment forever
        private Duration pendingTtl;

        @NotNull
        private Duration syncSendTimeout = Duration.ofSeconds(30);

        private Map<String, String> properties = new HashMap<>();
    }

    public enum Acks {
        NONE("0"),
        LOCAL("1"),
        IN_SYNC("all");

        private final String value;

        Acks(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }
}
