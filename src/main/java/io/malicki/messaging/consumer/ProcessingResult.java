package io.malicki.messaging.consumer;

import io.malicki.messaging.domain.message.CommitRecord;
import io.malicki.messaging.domain.message.Envelope;
import lombok.Value;

import java.util.Optional;

@Value
public class ProcessingResult {

    Envelope envelope;
    int attempts;
    Exception finalError;   // null when the handler eventually succeeded
    ProcessingOutcome outcome;
    CommitRecord commit;    // null when CANCELLED

    public boolean isSuccess() {
        return outcome == ProcessingOutcome.SUCCEEDED;
    }

    public Optional<CommitRecord> commitRecord() {
        return Optional.ofNullable(commit);
    }
}
