package io.malicki.messaging.consumer;

import io.malicki.messaging.domain.message.CommitRecord;
import io.malicki.messaging.domain.message.MessageId;
import io.malicki.messaging.exception.MessagingTransportException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Commits the position after a processed message. Commits for the same
 * topic-partition never run concurrently.
 */
@Slf4j
public class OffsetCommitTracker {

    private final OffsetCommitter committer;
    private final Map<String, Object> partitionLocks = new ConcurrentHashMap<>();

    public OffsetCommitTracker(OffsetCommitter committer) {
        this.committer = committer;
    }

    public CommitRecord commitPosition(MessageId id) {
        // Always the next offset: on restart delivery resumes after the last confirmed message
        CommitRecord record = CommitRecord.after(id);
        Object lock = partitionLocks.computeIfAbsent(id.getTopic() + "-" + id.getPartition(), k -> new Object());

        synchronized (lock) {
            log.debug("Committing offset | Topic: {} | Partition: {} | Offset: {}",
                    id.getTopic(), id.getPartition(), record.getNextOffset());
            try {
                committer.commit(record);
            } catch (MessagingTransportException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MessagingTransportException("Interrupted while committing offset " + record.getNextOffset(), e);
            } catch (Exception e) {
                throw new MessagingTransportException(
                    String.format("Commit failed | Topic: %s | Partition: %d | Offset: %d",
                        id.getTopic(), id.getPartition(), record.getNextOffset()),
                    e);
            }
        }

        log.debug("Committed offset | Topic: {} | Partition: {} | Offset: {}",
                id.getTopic(), id.getPartition(), record.getNextOffset());
        return record;
    }
}
