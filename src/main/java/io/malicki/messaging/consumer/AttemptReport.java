package io.malicki.messaging.consumer;

import io.malicki.messaging.domain.message.MessageId;
import lombok.Value;

import java.time.Duration;

@Value
public class AttemptReport {

    MessageId messageId;
    int attempt;
    Exception error;        // null when the attempt succeeded
    Duration nextDelay;     // null when no further attempt is scheduled

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isRetryScheduled() {
        return nextDelay != null;
    }
}
