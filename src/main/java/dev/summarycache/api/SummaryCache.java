package dev.summarycache.api;

import dev.summarycache.model.CacheStats;
import dev.summarycache.model.ChannelRecord;
import dev.summarycache.model.VideoRecord;
import dev.summarycache.sync.SyncResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * What screens and other callers see of the cache.
 *
 * <p>Every accessor other than {@code sync} works on the scope of the last user passed to {@code sync}.
 * Read accessors never throw; with no known user they return empty results. Write operations with no
 * known user are no-ops.
 */
public interface SummaryCache extends AutoCloseable {

    /**
     * Refreshes the cache for {@code userId} and returns the resulting view. Falls back to cached data when
     * the remote source fails.
     *
     * @param userId the authenticated user, null for a cached-only answer
     * @throws InvalidScopeException if {@code userId} is malformed
     * @throws SyncFailedException   if the remote source failed and nothing is cached
     */
    SyncResult sync(String userId);

    /**
     * Asynchronous {@link #sync(String)}. Calls for the same user while one is in flight share its result.
     */
    CompletableFuture<SyncResult> syncAsync(String userId);

    /**
     * The cached view without contacting the remote source.
     */
    SyncResult getCachedData();

    List<VideoRecord> getCachedVideos();

    List<ChannelRecord> getCachedChannels();

    CacheStats getCacheStats();

    /**
     * @return the remaining videos, newest first
     */
    List<VideoRecord> removeChannelVideos(String channelId);

    void signalChannelListChanged();

    /**
     * Records a new subscription, optionally caching its latest video right away.
     *
     * @param latestVideo the channel's newest upload as returned by the subscribe call, may be null
     */
    void onChannelAdded(ChannelRecord channel, VideoRecord latestVideo);

    void onChannelRemoved(String channelId);

    /**
     * @return false when critical corruption could not be repaired and a manual reset should be offered
     */
    boolean validateAndRepair();

    /**
     * Puts back the newest backup taken before a reset of the current scope.
     *
     * @return false when there is no backup, it fails its checksum, or no user has synced yet
     */
    boolean restoreFromBackup();

    void clearCache();

    @Override
    void close();
}
