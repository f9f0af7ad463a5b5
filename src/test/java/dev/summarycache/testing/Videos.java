package dev.summarycache.testing;

import dev.summarycache.model.ProcessingStatus;
import dev.summarycache.model.VideoRecord;

import java.time.Instant;

public final class Videos {
    private Videos() {}

    public static VideoRecord done(String id, String channel, Instant createdAt) {
        return new VideoRecord(id, channel, "title " + id, createdAt, createdAt, true, "summary of " + id, ProcessingStatus.DONE);
    }

    public static VideoRecord pending(String id, String channel, Instant createdAt) {
        return VideoRecord.pending(id, channel, "title " + id, createdAt, createdAt);
    }
}
