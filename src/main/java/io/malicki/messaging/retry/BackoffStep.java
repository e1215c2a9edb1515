package io.malicki.messaging.retry;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BackoffStep {

    Duration delay;
    boolean exhausted;

    static BackoffStep retryAfter(Duration delay) {
        return new BackoffStep(delay, false);
    }

    static BackoffStep stop() {
        return new BackoffStep(Duration.ZERO, true);
    }
}
