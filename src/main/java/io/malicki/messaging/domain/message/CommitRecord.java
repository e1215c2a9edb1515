package io.malicki.messaging.domain.message;

import lombok.Value;

@Value
public class CommitRecord {

    MessageId id;
    long nextOffset;

    public static CommitRecord after(MessageId id) {
        return new CommitRecord(id, id.getOffset() + 1);
    }
}
