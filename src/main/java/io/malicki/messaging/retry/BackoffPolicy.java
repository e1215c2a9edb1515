package io.malicki.messaging.retry;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential backoff. Given how many attempts have been made so far,
 * tells how long to wait before the next one, or that retrying is over.
 *
 * <p>The delay after attempt {@code n} is
 * {@code min(initialInterval * multiplier^(n-1), maxInterval)}. Retrying stops
 * once {@code maxAttempts} attempts have been made, or once the sum of the
 * scheduled delays would pass {@code maxElapsedTime}, whichever comes first.
 * Exhaustion never depends on the randomization factor.
 */
@Value
public class BackoffPolicy {

    public static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofSeconds(5);
    public static final double DEFAULT_MULTIPLIER = 1.25;
    public static final double DEFAULT_RANDOMIZATION_FACTOR = 0;
    public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofMinutes(30);
    public static final Duration DEFAULT_MAX_ELAPSED_TIME = Duration.ofHours(12);
    // 35 retries + the first attempt, as the consumer has always been configured
    public static final int DEFAULT_MAX_ATTEMPTS = 36;

    Duration initialInterval;
    double multiplier;
    double randomizationFactor;
    Duration maxInterval;
    Duration maxElapsedTime;  // ZERO disables the time bound
    int maxAttempts;

    @Builder(toBuilder = true)
    private BackoffPolicy(
        Duration initialInterval,
        double multiplier,
        double randomizationFactor,
        Duration maxInterval,
        Duration maxElapsedTime,
        int maxAttempts
    ) {
        if (initialInterval == null || initialInterval.isNegative()) {
            throw new IllegalArgumentException("initialInterval must be >= 0: " + initialInterval);
        }
        if (!(multiplier >= 1.0)) {
            throw new IllegalArgumentException("multiplier must be >= 1: " + multiplier);
        }
        if (randomizationFactor < 0 || randomizationFactor > 1) {
            throw new IllegalArgumentException("randomizationFactor must be within [0, 1]: " + randomizationFactor);
        }
        if (maxInterval == null || maxInterval.compareTo(initialInterval) < 0) {
            throw new IllegalArgumentException("maxInterval must be >= initialInterval: " + maxInterval);
        }
        if (maxElapsedTime == null || maxElapsedTime.isNegative()) {
            throw new IllegalArgumentException("maxElapsedTime must be >= 0: " + maxElapsedTime);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        this.initialInterval = initialInterval;
        this.multiplier = multiplier;
        this.randomizationFactor = randomizationFactor;
        this.maxInterval = maxInterval;
        this.maxElapsedTime = maxElapsedTime;
        this.maxAttempts = maxAttempts;
    }

    public static BackoffPolicy defaults() {
        return builder().build();
    }

    /**
     * @param attempt number of attempts already made, starting at 1
     */
    public BackoffStep nextDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1: " + attempt);
        }
        if (attempt >= maxAttempts) {
            return BackoffStep.stop();
        }

        double delayNanos = 0;
        double elapsedNanos = 0;
        double capNanos = maxInterval.toNanos();
        for (int n = 1; n <= attempt; n++) {
            delayNanos = n == 1
                ? initialInterval.toNanos()
                : Math.min(delayNanos * multiplier, capNanos);
            elapsedNanos += delayNanos;
        }

        if (!maxElapsedTime.isZero() && elapsedNanos > maxElapsedTime.toNanos()) {
            return BackoffStep.stop();
        }

        return BackoffStep.retryAfter(Duration.ofNanos(Math.round(randomize(delayNanos, capNanos))));
    }

    /**
     * Longest total time this policy can make a caller wait between the first
     * and the last attempt of one message, taking every delay at the top of
     * its randomization range. Handler execution time is not included.
     *
     * <p>Summation stops at {@code limit}, so an attempt-unbounded policy without
     * a time bound does not loop for ever.
     */
    public Duration worstCaseTotalDelay(Duration limit) {
        double capNanos = maxInterval.toNanos();
        double limitNanos = limit.toNanos();
        double delayNanos = 0;
        double elapsedNanos = 0;
        double totalNanos = 0;
        for (int n = 1; n < maxAttempts && totalNanos < limitNanos; n++) {
            delayNanos = n == 1
                ? initialInterval.toNanos()
                : Math.min(delayNanos * multiplier, capNanos);
            elapsedNanos += delayNanos;
            if (!maxElapsedTime.isZero() && elapsedNanos > maxElapsedTime.toNanos()) {
                break;
            }
            totalNanos += Math.min(delayNanos * (1 + randomizationFactor), capNanos);
        }
        return Duration.ofNanos(Math.round(Math.min(totalNanos, limitNanos)));
    }

    private double randomize(double delayNanos, double capNanos) {
        if (randomizationFactor == 0) {
            return delayNanos;
        }
        double delta = randomizationFactor * delayNanos;
        double low = delayNanos - delta;
        double high = delayNanos + delta;
        double value = low + ThreadLocalRandom.current().nextDouble() * (high - low);
        return Math.min(value, capNanos);
    }

    public static class BackoffPolicyBuilder {
        private Duration initialInterval = DEFAULT_INITIAL_INTERVAL;
        private double multiplier = DEFAULT_MULTIPLIER;
        private double randomizationFactor = DEFAULT_RANDOMIZATION_FACTOR;
        private Duration maxInterval = DEFAULT_MAX_INTERVAL;
        private Duration maxElapsedTime = DEFAULT_MAX_ELAPSED_TIME;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    }
}
