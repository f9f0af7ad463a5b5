package dev.summarycache.sync;

import dev.summarycache.api.ApiResponse;
import dev.summarycache.api.CacheException;
import dev.summarycache.api.RemoteFetchFailedException;
import dev.summarycache.api.SummaryApi;
import dev.summarycache.api.SyncFailedException;
import dev.summarycache.api.VideoPage;
import dev.summarycache.api.VideoPageRequest;
import dev.summarycache.config.CacheConfig;
import dev.summarycache.core.CacheRepository;
import dev.summarycache.model.CacheScope;
import dev.summarycache.model.ChannelRecord;
import dev.summarycache.model.SyncCursor;
import dev.summarycache.model.ValidationSnapshot;
import dev.summarycache.model.VideoRecord;
import dev.summarycache.validation.CacheRecovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Decides between full and incremental sync, fetches from the remote source and merges the result into
 * the repository.
 *
 * <p>A full sync runs on first use of a scope and whenever the channel-change signal is raised; it asks
 * for the newest page without a lower bound. Otherwise only records created after the last sync are
 * requested. A remote or persist failure falls back to the cached collection when it is non-empty.
 * A full sync clears only the channel-change generation it observed, so a channel added or removed while
 * it runs still forces the next sync to be full.
 *
 * <p>When a {@link CacheRecovery} is supplied, a scope whose last validation is older than
 * {@code validationIntervalHours} is validated and repaired before the sync reads it.
 *
 * <p><strong>Concurrency:</strong> at most one sync runs at a time. A call for the scope already in flight
 * shares the in-flight future; a call for another scope is queued behind it.
 */
public class SyncOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(SyncOrchestrator.class);
    static final String MDC_SCOPE = "cacheScope";

    private final CacheRepository repository;
    private final CacheRecovery recovery;
    private final SummaryApi api;
    private final CacheConfig config;
    private final Clock clock;
    private final Executor executor;

    private final Object flightLock = new Object();
    private String inFlightKey;
    private CompletableFuture<SyncResult> inFlight;

    public SyncOrchestrator(CacheRepository repository, SummaryApi api, CacheConfig config, Clock clock, Executor executor) {
        this(repository, null, api, config, clock, executor);
    }

    /**
     * @param recovery validation and repair run when the last validation is stale, null to never revalidate
     */
    public SyncOrchestrator(CacheRepository repository, CacheRecovery recovery, SummaryApi api, CacheConfig config,
                            Clock clock, Executor executor) {
        this.repository = Objects.requireNonNull(repository, "repository cannot be null");
        this.recovery = recovery;
        this.api = Objects.requireNonNull(api, "api cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = (clock != null) ? clock : Clock.systemUTC();
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    /**
     * Blocking form of {@link #syncAsync(String)}. Failures surface as the original
     * {@link CacheException}, not wrapped.
     */
    public SyncResult sync(String userId) {
        try {
            return syncAsync(userId).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    public CompletableFuture<SyncResult> syncAsync(String userId) {
        String key = userId == null ? "" : userId.trim();
        synchronized (flightLock) {
            if (inFlight != null && !inFlight.isDone()) {
                if (key.equals(inFlightKey)) {
                    logger.debug("Sync for '{}' already in flight, sharing its result", key);
                    return inFlight;
                }
                logger.debug("Queueing sync for '{}' behind in-flight sync for '{}'", key, inFlightKey);
                inFlight = inFlight.handle((r, e) -> null)
                        .thenApplyAsync(ignored -> doSync(userId), executor);
            } else {
                inFlight = CompletableFuture.supplyAsync(() -> doSync(userId), executor);
            }
            inFlightKey = key;
            return inFlight;
        }
    }

    /**
     * The cached view of the current owner without contacting the remote source.
     */
    public SyncResult cachedOnly() {
        Optional<CacheScope> scope = repository.currentScope();
        return scope.map(this::cachedResult).orElseGet(SyncResult::empty);
    }

    SyncResult doSync(String userId) {
        if (userId == null || userId.isBlank()) {
            logger.info("No authenticated user, answering from cache");
            return cachedOnly();
        }
        CacheScope scope = CacheScope.of(userId);
        MDC.put(MDC_SCOPE, scope.userId());
        try {
            return syncScope(scope);
        } finally {
            MDC.remove(MDC_SCOPE);
        }
    }

    private SyncResult syncScope(CacheScope scope) {
        long start = clock.millis();
        if (repository.checkUserChanged(scope)) {
            logger.info("New cache owner, previous data cleared");
        }
        revalidateIfDue(scope);

        List<VideoRecord> cached = repository.getCachedVideos(scope);
        Instant lastSync = repository.getLastSyncTimestamp(scope);
        long changeGeneration = repository.getChannelChangeGeneration(scope);
        boolean channelsChanged = changeGeneration != 0L;
        boolean full = channelsChanged || lastSync.equals(Instant.EPOCH);
        logger.info("Starting {} sync ({} cached, last sync {}, channels changed {})",
                full ? "full" : "incremental", cached.size(), lastSync, channelsChanged);

        List<VideoRecord> videos;
        boolean fromCache;
        Instant resultSync;
        String nextCursor;
        try {
            Instant now = clock.instant();
            if (full) {
                VideoPage page = fetchVideos(new VideoPageRequest(null, config.getFullSyncPageSize(), true));
                videos = repository.mergeVideos(scope, page.videos(), now);
                repository.clearChannelChangeSignal(scope, changeGeneration);
                fromCache = false;
                resultSync = now;
                nextCursor = page.nextCursor();
            } else {
                VideoPage page = fetchVideos(new VideoPageRequest(lastSync, config.getFullSyncPageSize(), false));
                if (page.videos().isEmpty()) {
                    logger.debug("No new videos since {}, cache left untouched", lastSync);
                    videos = cached;
                    fromCache = true;
                    resultSync = lastSync;
                } else {
                    videos = repository.mergeVideos(scope, page.videos(), now);
                    fromCache = false;
                    resultSync = now;
                }
                nextCursor = page.nextCursor() != null ? page.nextCursor() : cursorOf(videos);
            }
        } catch (CacheException e) {
            if (cached.isEmpty()) {
                logger.error("Sync failed with nothing cached: {}", e.getMessage(), e);
                throw new SyncFailedException("Sync failed for scope " + scope + " and no cached data is available", e);
            }
            logger.warn("Sync failed, serving {} cached videos: {}", cached.size(), e.getMessage());
            return new SyncResult(cached, true, lastSync, cursorOf(cached), repository.getCacheStats(scope));
        }

        refreshChannelsIfDue(scope, channelsChanged);

        try {
            int removed = repository.cleanOldVideos(scope);
            if (removed > 0) {
                videos = repository.getCachedVideos(scope);
            }
        } catch (CacheException e) {
            logger.warn("Retention cleanup failed: {}", e.getMessage(), e);
        }

        SyncResult result = new SyncResult(videos, fromCache, resultSync, nextCursor, repository.getCacheStats(scope));
        logger.info("Sync finished in {}ms: {} videos, fromCache {}", clock.millis() - start, videos.size(), fromCache);
        return result;
    }

    private void revalidateIfDue(CacheScope scope) {
        int intervalHours = config.getValidationIntervalHours();
        if (recovery == null || intervalHours <= 0) {
            return;
        }
        Instant validatedAt = repository.getLastValidation(scope)
                .map(ValidationSnapshot::validatedAt)
                .orElse(Instant.EPOCH);
        if (clock.instant().isBefore(validatedAt.plus(Duration.ofHours(intervalHours)))) {
            return;
        }
        logger.info("Last validation at {} is older than {}h, revalidating", validatedAt, intervalHours);
        if (!recovery.validateAndRepair(scope)) {
            logger.warn("Periodic repair left critical issues");
        }
    }

    private VideoPage fetchVideos(VideoPageRequest request) {
        ApiResponse<VideoPage> response;
        try {
            response = api.fetchVideoSummaries(request);
        } catch (RemoteFetchFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RemoteFetchFailedException("Video summary fetch failed: " + e.getMessage(), e);
        }
        if (response == null || !response.success() || response.data() == null) {
            throw new RemoteFetchFailedException("Video summary fetch failed: "
                    + (response == null ? "no response" : response.error()));
        }
        logger.debug("Fetched {} videos (since {}, limit {})",
                response.data().videos().size(), request.since(), request.limit());
        return response.data();
    }

    private void refreshChannelsIfDue(CacheScope scope, boolean channelsChanged) {
        Instant refreshedAt = repository.getChannelsRefreshedAt(scope);
        Duration interval = Duration.ofHours(config.getChannelRefreshIntervalHours());
        boolean stale = !clock.instant().isBefore(refreshedAt.plus(interval));
        if (!channelsChanged && !stale) {
            return;
        }
        try {
            ApiResponse<List<ChannelRecord>> response = api.fetchUserChannels(scope.userId());
            if (response == null || !response.success() || response.data() == null) {
                throw new RemoteFetchFailedException("Channel fetch failed: "
                        + (response == null ? "no response" : response.error()));
            }
            repository.saveChannelsToCache(scope, response.data());
            logger.info("Refreshed {} channels", response.data().size());
        } catch (RuntimeException e) {
            logger.warn("Channel refresh failed, keeping cached channels: {}", e.getMessage());
        }
    }

    private SyncResult cachedResult(CacheScope scope) {
        List<VideoRecord> cached = repository.getCachedVideos(scope);
        return new SyncResult(cached, true, repository.getLastSyncTimestamp(scope), cursorOf(cached),
                repository.getCacheStats(scope));
    }

    private static String cursorOf(List<VideoRecord> videos) {
        SyncCursor cursor = SyncCursor.fromVideos(videos);
        return cursor == null ? null : cursor.encode();
    }
}
