package dev.summarycache.core;

import dev.summarycache.api.CacheException;
import dev.summarycache.api.CorruptRecordException;
import dev.summarycache.api.InvalidScopeException;
import dev.summarycache.config.CacheConfig;
import dev.summarycache.model.CacheScope;
import dev.summarycache.model.CacheStats;
import dev.summarycache.model.ChannelRecord;
import dev.summarycache.model.ValidationSnapshot;
import dev.summarycache.model.ValidationStatus;
import dev.summarycache.model.VideoRecord;
import dev.summarycache.ser.JsonSerializer;
import dev.summarycache.ser.Serializer;
import dev.summarycache.ser.Utf8StringSerializer;
import dev.summarycache.store.CacheKeys;
import dev.summarycache.store.KeyValueStore;
import dev.summarycache.tx.OperationKind;
import dev.summarycache.tx.Transaction;
import dev.summarycache.tx.TransactionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import static dev.summarycache.store.Utils.decodeLong;
import static dev.summarycache.store.Utils.encodeLong;

/**
 * Owns the video and channel collections of every scope, their metadata keys and the scope owner.
 *
 * <p><strong>Failure policy:</strong> read accessors never throw. A record that cannot be decoded is
 * skipped and logged; a store that cannot be reached reads as an empty cache. Write operations propagate
 * {@link CacheException} so the caller can keep its previous good state.
 *
 * <p><strong>Thread Safety:</strong> Writes are serialized on an internal lock and every write touching
 * more than one key runs inside a {@link TransactionManager} transaction. Reads take no lock; they see
 * each record either fully old or fully new.
 */
public class CacheRepository {
    private static final Logger logger = LoggerFactory.getLogger(CacheRepository.class);

    private final KeyValueStore store;
    private final TransactionManager txManager;
    private final CacheConfig config;
    private final Clock clock;
    private final Serializer<VideoRecord> videoSerializer = new JsonSerializer<>();
    private final Serializer<ChannelRecord> channelSerializer = new JsonSerializer<>();
    private final Serializer<ValidationSnapshot> snapshotSerializer = new JsonSerializer<>();
    private final Serializer<CacheBackup> backupSerializer = new JsonSerializer<>();
    private final Serializer<String> ownerSerializer = new Utf8StringSerializer();
    private final Object writeLock = new Object();

    /**
     * @param store     the backing store
     * @param txManager transaction manager over the same store
     * @param config    working-set and retention settings
     * @param clock     time source, null for system UTC
     */
    public CacheRepository(KeyValueStore store, TransactionManager txManager, CacheConfig config, Clock clock) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.txManager = Objects.requireNonNull(txManager, "txManager cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = (clock != null) ? clock : Clock.systemUTC();
    }

    // ---------------------------------------------------------------- reads

    /**
     * @return the readable videos of {@code scope}, newest first; empty on any storage failure
     */
    public List<VideoRecord> getCachedVideos(CacheScope scope) {
        try {
            return readVideos(scope).list();
        } catch (RuntimeException e) {
            logger.error("Failed to read cached videos for scope {}: {}", scope, e.getMessage(), e);
            return List.of();
        }
    }

    /**
     * @return the readable channels of {@code scope} in key order; empty on any storage failure
     */
    public List<ChannelRecord> getCachedChannels(CacheScope scope) {
        try {
            List<ChannelRecord> channels = new ArrayList<>();
            for (String key : store.listKeys(CacheKeys.channelPrefix(scope))) {
                byte[] raw = store.get(key);
                if (raw == null) continue;
                try {
                    channels.add(channelSerializer.deserialize(raw, ChannelRecord.class));
                } catch (RuntimeException e) {
                    logger.warn("Skipping unreadable channel record '{}': {}", key, e.getMessage());
                }
            }
            return channels;
        } catch (RuntimeException e) {
            logger.error("Failed to read cached channels for scope {}: {}", scope, e.getMessage(), e);
            return List.of();
        }
    }

    /**
     * @return the last successful sync, {@link Instant#EPOCH} when never synced or unreadable
     */
    public Instant getLastSyncTimestamp(CacheScope scope) {
        return readInstant(CacheKeys.lastSync(scope));
    }

    /**
     * @return when channels were last refreshed from the remote source, {@link Instant#EPOCH} when never
     */
    public Instant getChannelsRefreshedAt(CacheScope scope) {
        return readInstant(CacheKeys.channelsRefreshedAt(scope));
    }

    public boolean hasChannelListChanged(CacheScope scope) {
        return getChannelChangeGeneration(scope) != 0L;
    }

    /**
     * Every raise of the channel-change signal bumps its generation, so a reader can later clear exactly
     * the change it observed.
     *
     * @return the current generation, 0 when no change is pending, -1 when the signal cannot be read
     */
    public long getChannelChangeGeneration(CacheScope scope) {
        try {
            return generationOf(store.get(CacheKeys.channelChanged(scope)));
        } catch (RuntimeException e) {
            // unknown reads as changed so the next sync is a full one
            logger.warn("Failed to read channel-change signal for scope {}: {}", scope, e.getMessage());
            return -1L;
        }
    }

    /**
     * @return the scope that owns the cache, empty on a fresh store or when the stored owner is unusable
     */
    public Optional<CacheScope> currentScope() {
        try {
            byte[] raw = store.get(CacheKeys.SCOPE_LAST_USER);
            if (raw == null) {
                return Optional.empty();
            }
            return Optional.of(CacheScope.of(ownerSerializer.deserialize(raw, String.class)));
        } catch (InvalidScopeException e) {
            logger.warn("Ignoring malformed scope owner: {}", e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.error("Failed to read scope owner: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    public Optional<ValidationSnapshot> getLastValidation(CacheScope scope) {
        try {
            byte[] raw = store.get(CacheKeys.lastValidation(scope));
            return raw == null ? Optional.empty()
                    : Optional.of(snapshotSerializer.deserialize(raw, ValidationSnapshot.class));
        } catch (RuntimeException e) {
            logger.warn("Failed to read validation snapshot for scope {}: {}", scope, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Computes stats over the current collection. Never throws; an unreachable store yields zero counts
     * with status {@link ValidationStatus#CORRUPTED}.
     */
    public CacheStats getCacheStats(CacheScope scope) {
        try {
            VideoScan scan = readVideos(scope);
            Instant oldest = null;
            Instant newest = null;
            for (VideoRecord v : scan.list()) {
                if (v.createdAt() == null) continue;
                if (oldest == null || v.createdAt().isBefore(oldest)) oldest = v.createdAt();
                if (newest == null || v.createdAt().isAfter(newest)) newest = v.createdAt();
            }
            Optional<ValidationSnapshot> validation = getLastValidation(scope);
            return new CacheStats(
                    scan.list().size(),
                    scan.bytes(),
                    getLastSyncTimestamp(scope),
                    validation.map(ValidationSnapshot::status).orElse(ValidationStatus.HEALTHY),
                    oldest,
                    newest,
                    validation.map(ValidationSnapshot::validatedAt).orElse(Instant.EPOCH));
        } catch (RuntimeException e) {
            logger.error("Failed to compute cache stats for scope {}: {}", scope, e.getMessage(), e);
            return new CacheStats(0, 0L, Instant.EPOCH, ValidationStatus.CORRUPTED, null, null, Instant.EPOCH);
        }
    }

    /**
     * Raw payloads of every video and channel record of {@code scope}, for structural inspection.
     *
     * @throws dev.summarycache.api.StorageUnavailableException if the store cannot be read
     */
    public SortedMap<String, byte[]> readRawRecords(CacheScope scope) {
        SortedMap<String, byte[]> raw = new TreeMap<>();
        for (String prefix : CacheKeys.recordPrefixes(scope)) {
            for (String key : store.listKeys(prefix)) {
                byte[] value = store.get(key);
                if (value != null) {
                    raw.put(key, value);
                }
            }
        }
        return raw;
    }

    // ---------------------------------------------------------------- writes

    /**
     * Replaces the whole video collection of {@code scope}. Duplicate ids keep the last occurrence; only
     * the newest {@code maxCachedVideos} are kept.
     *
     * @return the stored collection, newest first
     */
    public List<VideoRecord> saveVideosToCache(CacheScope scope, Collection<VideoRecord> records) {
        Objects.requireNonNull(records, "records cannot be null");
        synchronized (writeLock) {
            Map<String, VideoRecord> byId = new LinkedHashMap<>();
            for (VideoRecord r : records) {
                byId.put(r.videoId(), r);
            }
            List<VideoRecord> kept = bounded(byId.values());
            Set<String> keepKeys = keysOf(scope, kept);
            SortedMap<String, byte[]> existing = readRawVideos(scope);

            txManager.inTransaction(OperationKind.SAVE_VIDEOS, tx -> {
                for (String key : existing.keySet()) {
                    if (!keepKeys.contains(key)) tx.delete(key);
                }
                for (VideoRecord v : kept) {
                    putIfChanged(tx, existing, CacheKeys.video(scope, v.videoId()), videoSerializer.serialize(v));
                }
                return null;
            });
            logger.debug("Saved {} videos for scope {} ({} submitted)", kept.size(), scope, records.size());
            return kept;
        }
    }

    public List<VideoRecord> mergeVideos(CacheScope scope, Collection<VideoRecord> incoming) {
        return mergeVideos(scope, incoming, null);
    }

    /**
     * Merges {@code incoming} into the stored collection and persists the result.
     *
     * <p>An incoming record replaces the stored one with the same id unless the stored one is more complete
     * ({@link VideoRecord#isMoreCompleteThan(VideoRecord)}). Stored records missing from {@code incoming}
     * are kept. When {@code syncedAt} is given, the last-sync timestamp is written in the same transaction.
     *
     * @return the merged collection, newest first
     * @throws CacheException if the collection cannot be read or persisted
     */
    public List<VideoRecord> mergeVideos(CacheScope scope, Collection<VideoRecord> incoming, Instant syncedAt) {
        Objects.requireNonNull(incoming, "incoming cannot be null");
        synchronized (writeLock) {
            long start = clock.millis();
            VideoScan locals = readVideos(scope);
            Map<String, VideoRecord> merged = new LinkedHashMap<>();
            for (VideoRecord local : locals.list()) {
                merged.put(local.videoId(), local);
            }
            int kept = 0;
            for (VideoRecord in : incoming) {
                VideoRecord local = merged.get(in.videoId());
                if (local != null && local.isMoreCompleteThan(in)) {
                    kept++;
                    logger.debug("Keeping completed summary of video {} over incoming unprocessed copy", in.videoId());
                    continue;
                }
                merged.put(in.videoId(), in);
            }

            List<VideoRecord> result = bounded(merged.values());
            Set<String> keepKeys = keysOf(scope, result);
            SortedMap<String, byte[]> existing = readRawVideos(scope);

            txManager.inTransaction(OperationKind.MERGE_VIDEOS, tx -> {
                for (String key : existing.keySet()) {
                    if (!keepKeys.contains(key) && locals.ids().contains(CacheKeys.recordIdOf(key))) {
                        tx.delete(key);
                    }
                }
                for (VideoRecord v : result) {
                    putIfChanged(tx, existing, CacheKeys.video(scope, v.videoId()), videoSerializer.serialize(v));
                }
                if (syncedAt != null) {
                    tx.put(CacheKeys.lastSync(scope), encodeLong(syncedAt.toEpochMilli()));
                }
                return null;
            });

            logger.info("Merged {} incoming videos into {} cached for scope {} (kept {} completed, total {}) in {}ms",
                    incoming.size(), locals.list().size(), scope, kept, result.size(), clock.millis() - start);
            return result;
        }
    }

    /**
     * Deletes every video of {@code channelId}.
     *
     * @return the remaining videos, newest first
     */
    public List<VideoRecord> removeChannelVideos(CacheScope scope, String channelId) {
        Objects.requireNonNull(channelId, "channelId cannot be null");
        synchronized (writeLock) {
            List<VideoRecord> all = readVideos(scope).list();
            List<VideoRecord> remaining = new ArrayList<>();
            List<String> doomed = new ArrayList<>();
            for (VideoRecord v : all) {
                if (channelId.equals(v.channelId())) {
                    doomed.add(CacheKeys.video(scope, v.videoId()));
                } else {
                    remaining.add(v);
                }
            }
            if (!doomed.isEmpty()) {
                txManager.inTransaction(OperationKind.REMOVE_CHANNEL_VIDEOS, tx -> {
                    doomed.forEach(tx::delete);
                    return null;
                });
            }
            logger.info("Removed {} videos of channel {} for scope {}", doomed.size(), channelId, scope);
            return remaining;
        }
    }

    /**
     * Applies the retention horizon ({@code retentionDays} against {@code createdAt}). No-op returning 0
     * when retention is disabled.
     *
     * @return the number of videos removed
     */
    public int cleanOldVideos(CacheScope scope) {
        if (!config.isRetentionEnabled()) {
            return 0;
        }
        synchronized (writeLock) {
            Instant horizon = clock.instant().minus(Duration.ofDays(config.getRetentionDays()));
            List<String> doomed = new ArrayList<>();
            for (VideoRecord v : readVideos(scope).list()) {
                if (v.createdAtOrEpoch().isBefore(horizon)) {
                    doomed.add(CacheKeys.video(scope, v.videoId()));
                }
            }
            if (doomed.isEmpty()) {
                return 0;
            }
            txManager.inTransaction(OperationKind.CLEAN_OLD_VIDEOS, tx -> {
                doomed.forEach(tx::delete);
                return null;
            });
            logger.info("Retention removed {} videos older than {} for scope {}", doomed.size(), horizon, scope);
            return doomed.size();
        }
    }

    /**
     * Replaces the channel collection of {@code scope} and stamps the refresh time.
     */
    public void saveChannelsToCache(CacheScope scope, Collection<ChannelRecord> channels) {
        Objects.requireNonNull(channels, "channels cannot be null");
        synchronized (writeLock) {
            Map<String, byte[]> next = new LinkedHashMap<>();
            for (ChannelRecord c : channels) {
                next.put(CacheKeys.channel(scope, c.channelId()), channelSerializer.serialize(c));
            }
            Set<String> existing = store.listKeys(CacheKeys.channelPrefix(scope));
            txManager.inTransaction(OperationKind.SAVE_CHANNELS, tx -> {
                for (String key : existing) {
                    if (!next.containsKey(key)) tx.delete(key);
                }
                next.forEach(tx::put);
                tx.put(CacheKeys.channelsRefreshedAt(scope), encodeLong(clock.millis()));
                return null;
            });
            logger.debug("Saved {} channels for scope {}", next.size(), scope);
        }
    }

    /**
     * Stores a newly subscribed channel, optimistically caches its latest video and raises the
     * channel-change signal, all in one transaction. A stored copy of the video that is more complete
     * than {@code latestVideo} is kept.
     */
    public void addChannel(CacheScope scope, ChannelRecord channel, VideoRecord latestVideo) {
        Objects.requireNonNull(channel, "channel cannot be null");
        synchronized (writeLock) {
            VideoRecord video = null;
            if (latestVideo != null) {
                String key = CacheKeys.video(scope, latestVideo.videoId());
                VideoRecord stored = decodeOrNull(key, store.get(key));
                video = (stored != null && stored.isMoreCompleteThan(latestVideo)) ? null : latestVideo;
            }
            VideoRecord toWrite = video;
            byte[] signal = nextChannelChangeGeneration(scope);
            txManager.inTransaction(OperationKind.SAVE_CHANNELS, tx -> {
                tx.put(CacheKeys.channel(scope, channel.channelId()), channelSerializer.serialize(channel));
                if (toWrite != null) {
                    tx.put(CacheKeys.video(scope, toWrite.videoId()), videoSerializer.serialize(toWrite));
                }
                tx.put(CacheKeys.channelChanged(scope), signal);
                return null;
            });
            logger.info("Added channel {} for scope {} (latest video cached: {})",
                    channel.channelId(), scope, toWrite != null);
        }
    }

    /**
     * Removes a channel, its videos and raises the channel-change signal in one transaction.
     *
     * @return the number of videos removed
     */
    public int removeChannel(CacheScope scope, String channelId) {
        Objects.requireNonNull(channelId, "channelId cannot be null");
        synchronized (writeLock) {
            List<String> videoKeys = new ArrayList<>();
            for (VideoRecord v : readVideos(scope).list()) {
                if (channelId.equals(v.channelId())) {
                    videoKeys.add(CacheKeys.video(scope, v.videoId()));
                }
            }
            byte[] signal = nextChannelChangeGeneration(scope);
            txManager.inTransaction(OperationKind.REMOVE_CHANNEL_VIDEOS, tx -> {
                tx.delete(CacheKeys.channel(scope, channelId));
                videoKeys.forEach(tx::delete);
                tx.put(CacheKeys.channelChanged(scope), signal);
                return null;
            });
            logger.info("Removed channel {} and {} of its videos for scope {}", channelId, videoKeys.size(), scope);
            return videoKeys.size();
        }
    }

    /**
     * Admits {@code scope} as the cache owner. When a different user owned the cache, the data of both
     * scopes is cleared in the same transaction that records the new owner.
     *
     * @return true when the owner changed
     */
    public boolean checkUserChanged(CacheScope scope) {
        Objects.requireNonNull(scope, "scope cannot be null");
        synchronized (writeLock) {
            byte[] raw = store.get(CacheKeys.SCOPE_LAST_USER);
            String previous = raw == null ? null : ownerSerializer.deserialize(raw, String.class);
            if (scope.userId().equals(previous)) {
                return false;
            }

            List<String> candidates = new ArrayList<>();
            for (CacheScope s : scopesOf(previous, scope)) {
                for (String prefix : CacheKeys.recordPrefixes(s)) {
                    candidates.addAll(store.listKeys(prefix));
                }
                for (String meta : CacheKeys.metaKeys(s)) {
                    if (store.get(meta) != null) candidates.add(meta);
                }
                candidates.addAll(store.listKeys(CacheKeys.backupPrefix(s)));
            }
            ScopeTransition transition = ScopeTransition.clearAndReseed(previous, scope, candidates);

            txManager.inTransaction(OperationKind.SWITCH_SCOPE, tx -> {
                transition.keysToClear().forEach(tx::delete);
                tx.put(CacheKeys.SCOPE_LAST_USER, ownerSerializer.serialize(scope.userId()));
                return null;
            });
            logger.info("Cache owner changed from {} to {}, cleared {} keys",
                    previous, scope, transition.keysToClear().size());
            return true;
        }
    }

    public void signalChannelListChanged(CacheScope scope) {
        synchronized (writeLock) {
            store.set(CacheKeys.channelChanged(scope), nextChannelChangeGeneration(scope));
        }
        logger.debug("Channel-change signal raised for scope {}", scope);
    }

    /**
     * Clears the signal whatever its generation.
     */
    public void clearChannelChangeSignal(CacheScope scope) {
        synchronized (writeLock) {
            store.delete(CacheKeys.channelChanged(scope));
        }
        logger.debug("Channel-change signal cleared for scope {}", scope);
    }

    /**
     * Clears the signal only while it still holds {@code observedGeneration}. A change raised after the
     * caller read the signal stays pending.
     *
     * @return true when no change newer than {@code observedGeneration} is pending afterwards
     */
    public boolean clearChannelChangeSignal(CacheScope scope, long observedGeneration) {
        synchronized (writeLock) {
            byte[] raw = store.get(CacheKeys.channelChanged(scope));
            long current = generationOf(raw);
            if (current != observedGeneration) {
                logger.info("Channel list of scope {} changed again (generation {} -> {}), keeping the signal",
                        scope, observedGeneration, current);
                return false;
            }
            if (raw != null) {
                store.delete(CacheKeys.channelChanged(scope));
                logger.debug("Channel-change signal generation {} cleared for scope {}", current, scope);
            }
            return true;
        }
    }

    /**
     * Deletes every record and metadata key of {@code scope}. The scope owner and the backups are kept.
     */
    public void clearCache(CacheScope scope) {
        synchronized (writeLock) {
            List<String> keys = new ArrayList<>();
            for (String prefix : CacheKeys.recordPrefixes(scope)) {
                keys.addAll(store.listKeys(prefix));
            }
            keys.addAll(Arrays.asList(CacheKeys.metaKeys(scope)));
            txManager.inTransaction(OperationKind.CLEAR_SCOPE, tx -> {
                keys.forEach(tx::delete);
                return null;
            });
            logger.info("Cleared cache for scope {} ({} keys)", scope, keys.size());
        }
    }

    /**
     * Deletes {@code deleteKeys} and rewrites {@code rewrites} in one transaction. Every key must belong
     * to {@code scope}.
     */
    public void applyRepair(CacheScope scope, Collection<String> deleteKeys, Collection<VideoRecord> rewrites) {
        for (String key : deleteKeys) {
            if (!scope.userId().equals(CacheKeys.scopeIdOf(key))) {
                throw new IllegalArgumentException("Key " + key + " does not belong to scope " + scope);
            }
        }
        if (deleteKeys.isEmpty() && rewrites.isEmpty()) {
            return;
        }
        synchronized (writeLock) {
            txManager.inTransaction(OperationKind.REPAIR, tx -> {
                deleteKeys.forEach(tx::delete);
                for (VideoRecord v : rewrites) {
                    tx.put(CacheKeys.video(scope, v.videoId()), videoSerializer.serialize(v));
                }
                return null;
            });
        }
        logger.info("Repaired scope {}: deleted {}, rewrote {}", scope, deleteKeys.size(), rewrites.size());
    }

    /**
     * Copies the records and sync timestamps of {@code scope} into a new backup and prunes all but the
     * newest {@code maxBackups} backups of the scope, in one transaction.
     *
     * @return the key of the new backup
     */
    public String createBackup(CacheScope scope) {
        synchronized (writeLock) {
            SortedMap<String, byte[]> entries = readRawRecords(scope);
            for (String key : backedUpMetaKeys(scope)) {
                byte[] value = store.get(key);
                if (value != null) entries.put(key, value);
            }
            Instant now = clock.instant();
            CacheBackup backup = CacheBackup.of(scope.userId(), now, entries);
            String backupKey = CacheKeys.backup(scope, now.toEpochMilli());

            List<String> older = new ArrayList<>(store.listKeys(CacheKeys.backupPrefix(scope)));
            older.remove(backupKey);
            int keepOlder = Math.max(1, config.getMaxBackups()) - 1;
            List<String> expired = older.size() > keepOlder
                    ? new ArrayList<>(older.subList(0, older.size() - keepOlder))
                    : List.of();

            txManager.inTransaction(OperationKind.BACKUP, tx -> {
                tx.put(backupKey, backupSerializer.serialize(backup));
                expired.forEach(tx::delete);
                return null;
            });
            logger.info("Backed up {} keys of scope {} to '{}' (pruned {} older backups)",
                    entries.size(), scope, backupKey, expired.size());
            return backupKey;
        }
    }

    /**
     * Replaces the records and sync timestamps of {@code scope} with its newest backup. A missing,
     * unreadable or checksum-failing backup leaves the scope untouched.
     *
     * @return true when a backup was restored
     */
    public boolean restoreFromBackup(CacheScope scope) {
        synchronized (writeLock) {
            SortedSet<String> backups = store.listKeys(CacheKeys.backupPrefix(scope));
            if (backups.isEmpty()) {
                logger.warn("No backup to restore for scope {}", scope);
                return false;
            }
            String backupKey = backups.last();
            byte[] raw = store.get(backupKey);
            if (raw == null) {
                logger.warn("Backup '{}' disappeared before it could be read", backupKey);
                return false;
            }
            CacheBackup backup;
            try {
                backup = backupSerializer.deserialize(raw, CacheBackup.class);
            } catch (RuntimeException e) {
                logger.error("Backup '{}' is unreadable: {}", backupKey, e.getMessage());
                return false;
            }
            if (!backup.isIntact()) {
                logger.error("Backup '{}' failed its checksum, not restoring", backupKey);
                return false;
            }
            for (String key : backup.entries().keySet()) {
                if (!scope.userId().equals(CacheKeys.scopeIdOf(key))) {
                    logger.error("Backup '{}' holds key '{}' outside scope {}, not restoring", backupKey, key, scope);
                    return false;
                }
            }

            List<String> current = new ArrayList<>();
            for (String prefix : CacheKeys.recordPrefixes(scope)) {
                current.addAll(store.listKeys(prefix));
            }
            current.addAll(backedUpMetaKeys(scope));
            SortedMap<String, byte[]> restored = backup.entries();
            txManager.inTransaction(OperationKind.RESTORE_BACKUP, tx -> {
                for (String key : current) {
                    if (!restored.containsKey(key)) tx.delete(key);
                }
                restored.forEach(tx::put);
                return null;
            });
            logger.info("Restored scope {} from backup '{}' taken at {} ({} keys)",
                    scope, backupKey, backup.createdAt(), restored.size());
            return true;
        }
    }

    public void recordValidation(CacheScope scope, ValidationStatus status) {
        ValidationSnapshot snapshot = new ValidationSnapshot(status, clock.instant());
        store.set(CacheKeys.lastValidation(scope), snapshotSerializer.serialize(snapshot));
    }

    // ---------------------------------------------------------------- internals

    private record VideoScan(List<VideoRecord> list, Set<String> ids, long bytes) {}

    /**
     * Decodes every video of the scope, skipping unreadable ones. Storage failures propagate.
     */
    private VideoScan readVideos(CacheScope scope) {
        List<VideoRecord> videos = new ArrayList<>();
        Set<String> ids = new TreeSet<>();
        long bytes = 0;
        for (Map.Entry<String, byte[]> e : readRawVideos(scope).entrySet()) {
            VideoRecord v = decodeOrNull(e.getKey(), e.getValue());
            if (v == null) continue;
            if (!ids.add(v.videoId())) {
                logger.warn("Skipping duplicate video id {} stored under '{}'", v.videoId(), e.getKey());
                continue;
            }
            videos.add(v);
            bytes += e.getValue().length;
        }
        videos.sort(VideoRecord.NEWEST_FIRST);
        return new VideoScan(videos, ids, bytes);
    }

    private SortedMap<String, byte[]> readRawVideos(CacheScope scope) {
        SortedMap<String, byte[]> raw = new TreeMap<>();
        for (String key : store.listKeys(CacheKeys.videoPrefix(scope))) {
            byte[] value = store.get(key);
            if (value != null) raw.put(key, value);
        }
        return raw;
    }

    private VideoRecord decodeOrNull(String key, byte[] raw) {
        if (raw == null) {
            return null;
        }
        try {
            return decodeVideo(key, raw);
        } catch (CorruptRecordException e) {
            logger.warn("Skipping corrupt video record: {}", e.getMessage());
            return null;
        }
    }

    private VideoRecord decodeVideo(String key, byte[] raw) {
        try {
            VideoRecord v = videoSerializer.deserialize(raw, VideoRecord.class);
            if (v == null) {
                throw new CorruptRecordException(key, "Empty video payload", null);
            }
            return v;
        } catch (CorruptRecordException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CorruptRecordException(key, "Undecodable video payload", e);
        }
    }

    private List<VideoRecord> bounded(Collection<VideoRecord> records) {
        List<VideoRecord> sorted = new ArrayList<>(records);
        sorted.sort(VideoRecord.NEWEST_FIRST);
        int max = Math.max(0, config.getMaxCachedVideos());
        if (sorted.size() > max) {
            logger.debug("Working set bound evicts {} oldest videos", sorted.size() - max);
            return new ArrayList<>(sorted.subList(0, max));
        }
        return sorted;
    }

    private static Set<String> keysOf(CacheScope scope, Collection<VideoRecord> videos) {
        Set<String> keys = new TreeSet<>();
        for (VideoRecord v : videos) {
            keys.add(CacheKeys.video(scope, v.videoId()));
        }
        return keys;
    }

    private static void putIfChanged(Transaction tx, Map<String, byte[]> existing, String key, byte[] value) {
        if (!Arrays.equals(existing.get(key), value)) {
            tx.put(key, value);
        }
    }

    private static List<String> backedUpMetaKeys(CacheScope scope) {
        return List.of(CacheKeys.lastSync(scope), CacheKeys.channelsRefreshedAt(scope));
    }

    /**
     * Must be called under {@code writeLock}.
     */
    private byte[] nextChannelChangeGeneration(CacheScope scope) {
        long current = generationOf(store.get(CacheKeys.channelChanged(scope)));
        return encodeLong(Math.max(0L, current) + 1);
    }

    private static long generationOf(byte[] raw) {
        // a payload that is not a generation still means a change is pending
        return raw == null ? 0L : decodeLong(raw, 1L);
    }

    private Instant readInstant(String key) {
        try {
            return Instant.ofEpochMilli(decodeLong(store.get(key), 0L));
        } catch (RuntimeException e) {
            logger.warn("Failed to read timestamp '{}': {}", key, e.getMessage());
            return Instant.EPOCH;
        }
    }

    private static List<CacheScope> scopesOf(String previous, CacheScope next) {
        List<CacheScope> scopes = new ArrayList<>();
        scopes.add(next);
        if (previous != null) {
            try {
                scopes.add(CacheScope.of(previous));
            } catch (InvalidScopeException e) {
                logger.warn("Stored cache owner '{}' is malformed, only clearing scope {}", previous, next);
            }
        }
        return scopes;
    }
}
