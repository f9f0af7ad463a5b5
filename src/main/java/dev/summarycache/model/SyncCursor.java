package dev.summarycache.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Opaque paging token naming the oldest record of the most recent page.
 * Wire form: {@code <createdAtMillis>_<videoId>}.
 */
public record SyncCursor(long lastCreatedAtMillis, String lastVideoId) {

    public SyncCursor {
        Objects.requireNonNull(lastVideoId, "lastVideoId cannot be null");
    }

    /**
     * Builds the cursor from a page of records using {@link VideoRecord#NEWEST_FIRST}.
     *
     * @return the cursor for the last (oldest) record, or null for an empty page
     */
    public static SyncCursor fromVideos(Collection<VideoRecord> videos) {
        if (videos == null || videos.isEmpty()) {
            return null;
        }
        List<VideoRecord> sorted = new ArrayList<>(videos);
        sorted.sort(VideoRecord.NEWEST_FIRST);
        VideoRecord last = sorted.get(sorted.size() - 1);
        return new SyncCursor(last.createdAtOrEpoch().toEpochMilli(), last.videoId());
    }

    public static SyncCursor decode(String token) {
        Objects.requireNonNull(token, "token cannot be null");
        int sep = token.indexOf('_');
        if (sep <= 0 || sep == token.length() - 1) {
            throw new IllegalArgumentException("Malformed cursor: " + token);
        }
        try {
            return new SyncCursor(Long.parseLong(token.substring(0, sep)), token.substring(sep + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed cursor: " + token, e);
        }
    }

    public String encode() {
        return lastCreatedAtMillis + "_" + lastVideoId;
    }
}
