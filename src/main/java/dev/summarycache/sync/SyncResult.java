package dev.summarycache.sync;

import dev.summarycache.model.CacheStats;
import dev.summarycache.model.VideoRecord;

import java.time.Instant;
import java.util.List;

/**
 * What a sync hands back to its caller.
 *
 * @param videos     the cached collection after the sync, newest first
 * @param fromCache  true when the videos were not refreshed from the remote source in this call
 * @param lastSync   last successful sync, {@link Instant#EPOCH} when never synced
 * @param nextCursor token for the next page, null when there is nothing to page from
 * @param cacheStats stats of the collection after the sync
 */
public record SyncResult(List<VideoRecord> videos, boolean fromCache, Instant lastSync, String nextCursor,
                         CacheStats cacheStats) {
    public SyncResult {
        videos = List.copyOf(videos);
    }

    static SyncResult empty() {
        return new SyncResult(List.of(), true, Instant.EPOCH, null, CacheStats.empty());
    }
}
