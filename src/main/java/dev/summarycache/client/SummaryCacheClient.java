package dev.summarycache.client;

import dev.summarycache.api.SummaryApi;
import dev.summarycache.api.SummaryCache;
import dev.summarycache.config.CacheConfig;
import dev.summarycache.core.CacheRepository;
import dev.summarycache.model.CacheScope;
import dev.summarycache.model.CacheStats;
import dev.summarycache.model.ChannelRecord;
import dev.summarycache.model.VideoRecord;
import dev.summarycache.store.CacheKeys;
import dev.summarycache.store.KeyValueStore;
import dev.summarycache.store.RocksKeyValueStore;
import dev.summarycache.sync.SyncOrchestrator;
import dev.summarycache.sync.SyncResult;
import dev.summarycache.tx.RecoveryReport;
import dev.summarycache.tx.TransactionManager;
import dev.summarycache.validation.CacheRecovery;
import dev.summarycache.validation.CacheValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires the store, transaction manager, repository, validator and sync orchestrator together and owns
 * their lifecycle.
 *
 * <p><strong>Startup:</strong> the constructor recovers transactions left pending by a previous process
 * before anything else reads the store, forces a full sync for every scope that lost keys during that
 * recovery, and optionally validates and repairs the last known scope. Later syncs revalidate a scope
 * whose last validation is older than {@code validationIntervalHours}.
 *
 * <p><strong>Usage Pattern:</strong>
 * <pre>{@code
 * try (SummaryCacheClient cache = SummaryCacheClient.open(new CacheConfig(), api)) {
 *     SyncResult first = cache.sync("42");          // full sync on first run
 *     List<VideoRecord> videos = cache.getCachedVideos();
 *     cache.onChannelRemoved("UCxyz");              // next sync is full again
 * }
 * }</pre>
 */
public class SummaryCacheClient implements SummaryCache {
    private static final Logger logger = LoggerFactory.getLogger(SummaryCacheClient.class);

    private final KeyValueStore store;
    private final CacheRepository repository;
    private final CacheRecovery recovery;
    private final SyncOrchestrator orchestrator;
    private final ExecutorService executor;
    private final RecoveryReport startupRecovery;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Opens (creating if missing) the RocksDB-backed cache described by {@code config}.
     */
    public static SummaryCacheClient open(CacheConfig config, SummaryApi api) {
        return open(config, api, null);
    }

    public static SummaryCacheClient open(CacheConfig config, SummaryApi api, Clock clock) {
        Objects.requireNonNull(config, "config cannot be null");
        RocksKeyValueStore store = new RocksKeyValueStore(config);
        try {
            return new SummaryCacheClient(store, config, api, clock);
        } catch (RuntimeException e) {
            store.close();
            throw e;
        }
    }

    /**
     * @param store  the backing store, owned and closed by this client
     * @param config cache settings
     * @param api    the remote source
     * @param clock  time source, null for system UTC
     */
    public SummaryCacheClient(KeyValueStore store, CacheConfig config, SummaryApi api, Clock clock) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(api, "api cannot be null");

        TransactionManager txManager = new TransactionManager(store, clock);
        this.repository = new CacheRepository(store, txManager, config, clock);
        CacheValidator validator = new CacheValidator(repository, config, clock);
        this.recovery = new CacheRecovery(repository, validator, config);

        this.startupRecovery = txManager.recoverIncompleteTransactions();
        forceFullSyncAfterDiscards(startupRecovery);

        if (config.isValidateOnStartup()) {
            repository.currentScope().ifPresent(scope -> {
                if (!recovery.validateAndRepair(scope)) {
                    logger.warn("Startup repair of scope {} left critical issues", scope);
                }
            });
        }

        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "summary-cache-sync");
            t.setDaemon(true);
            return t;
        });
        this.orchestrator = new SyncOrchestrator(repository, recovery, api, config, clock, executor);
        logger.info("Summary cache ready (recovered transactions: {})", startupRecovery.inspected());
    }

    private void forceFullSyncAfterDiscards(RecoveryReport report) {
        SortedSet<String> scopes = new TreeSet<>();
        for (String key : report.discardedKeys()) {
            String scopeId = CacheKeys.scopeIdOf(key);
            if (scopeId != null) scopes.add(scopeId);
        }
        for (String scopeId : scopes) {
            try {
                repository.signalChannelListChanged(CacheScope.of(scopeId));
                logger.warn("Forcing full sync for scope {} after discarding interrupted writes", scopeId);
            } catch (RuntimeException e) {
                logger.error("Could not force full sync for scope {}: {}", scopeId, e.getMessage(), e);
            }
        }
    }

    public RecoveryReport getStartupRecovery() {
        return startupRecovery;
    }

    @Override
    public SyncResult sync(String userId) {
        ensureOpen();
        return orchestrator.sync(userId);
    }

    @Override
    public CompletableFuture<SyncResult> syncAsync(String userId) {
        ensureOpen();
        return orchestrator.syncAsync(userId);
    }

    @Override
    public SyncResult getCachedData() {
        return orchestrator.cachedOnly();
    }

    @Override
    public List<VideoRecord> getCachedVideos() {
        return scope().map(repository::getCachedVideos).orElse(List.of());
    }

    @Override
    public List<ChannelRecord> getCachedChannels() {
        return scope().map(repository::getCachedChannels).orElse(List.of());
    }

    @Override
    public CacheStats getCacheStats() {
        return scope().map(repository::getCacheStats).orElseGet(CacheStats::empty);
    }

    @Override
    public List<VideoRecord> removeChannelVideos(String channelId) {
        Optional<CacheScope> scope = writableScope("removeChannelVideos");
        return scope.map(s -> repository.removeChannelVideos(s, channelId)).orElse(List.of());
    }

    @Override
    public void signalChannelListChanged() {
        writableScope("signalChannelListChanged").ifPresent(repository::signalChannelListChanged);
    }

    @Override
    public void onChannelAdded(ChannelRecord channel, VideoRecord latestVideo) {
        writableScope("onChannelAdded").ifPresent(s -> repository.addChannel(s, channel, latestVideo));
    }

    @Override
    public void onChannelRemoved(String channelId) {
        writableScope("onChannelRemoved").ifPresent(s -> repository.removeChannel(s, channelId));
    }

    @Override
    public boolean validateAndRepair() {
        ensureOpen();
        Optional<CacheScope> scope = repository.currentScope();
        return scope.map(recovery::validateAndRepair).orElse(true);
    }

    @Override
    public boolean restoreFromBackup() {
        return writableScope("restoreFromBackup").map(recovery::restoreFromBackup).orElse(false);
    }

    @Override
    public void clearCache() {
        writableScope("clearCache").ifPresent(repository::clearCache);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Sync worker did not stop in time, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        try {
            store.close();
        } catch (Exception e) {
            logger.error("Failed to close store: {}", e.getMessage(), e);
        }
        logger.info("Summary cache closed");
    }

    public boolean isClosed() {
        return closed.get();
    }

    private Optional<CacheScope> scope() {
        if (closed.get()) {
            return Optional.empty();
        }
        return repository.currentScope();
    }

    private Optional<CacheScope> writableScope(String operation) {
        ensureOpen();
        Optional<CacheScope> scope = repository.currentScope();
        if (scope.isEmpty()) {
            logger.warn("{} ignored, no user has synced yet", operation);
        }
        return scope;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Summary cache is closed");
        }
    }
}
