package dev.summarycache.validation;

import dev.summarycache.config.CacheConfig;
import dev.summarycache.core.CacheBackup;
import dev.summarycache.core.CacheRepository;
import dev.summarycache.model.CacheScope;
import dev.summarycache.model.VideoRecord;
import dev.summarycache.ser.JsonSerializer;
import dev.summarycache.store.CacheKeys;
import dev.summarycache.store.InMemoryKeyValueStore;
import dev.summarycache.testing.MutableClock;
import dev.summarycache.testing.Videos;
import dev.summarycache.tx.TransactionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class CacheRecoveryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    private InMemoryKeyValueStore store;
    private CacheRepository repo;
    private CacheRecovery recovery;
    private final CacheScope scope = CacheScope.of("42");

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        MutableClock clock = MutableClock.at(T0.plusSeconds(3600));
        CacheConfig config = new CacheConfig();
        repo = new CacheRepository(store, new TransactionManager(store, clock), config, clock);
        recovery = new CacheRecovery(repo, new CacheValidator(repo, config, clock), config);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void deletesSingleUnparsableRecordAndKeepsTheRest() {
        List<VideoRecord> valid = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            valid.add(Videos.done("v" + i, "A", T0.plusSeconds(i)));
        }
        repo.saveVideosToCache(scope, valid);
        String bad = CacheKeys.video(scope, "bad");
        put(bad, "\u0000\u0001garbage");

        assertTrue(recovery.validateAndRepair(scope));

        assertNull(store.get(bad));
        assertEquals(5, repo.getCachedVideos(scope).size());
        assertFalse(repo.hasChannelListChanged(scope));
    }

    @Test
    void majorityCorruptionResetsScopeAndForcesFullSync() {
        repo.mergeVideos(scope, List.of(Videos.done("ok", "A", T0)), T0);
        put(CacheKeys.video(scope, "x"), "{");
        put(CacheKeys.video(scope, "y"), "{\"channelId\":\"A\"}");

        RepairReport report = recovery.repair(scope);

        assertTrue(report.success());
        assertTrue(report.reset());
        assertTrue(repo.getCachedVideos(scope).isEmpty());
        assertTrue(store.listKeys(CacheKeys.videoPrefix(scope)).isEmpty());
        assertTrue(repo.hasChannelListChanged(scope));
        assertEquals(Instant.EPOCH, repo.getLastSyncTimestamp(scope));
    }

    @Test
    void resetIsPrecededByRestorableBackup() {
        repo.mergeVideos(scope, List.of(Videos.done("ok", "A", T0)), T0);
        put(CacheKeys.video(scope, "x"), "{");
        put(CacheKeys.video(scope, "y"), "{\"channelId\":\"A\"}");

        assertTrue(recovery.repair(scope).reset());
        assertEquals(1, store.listKeys(CacheKeys.backupPrefix(scope)).size());

        assertTrue(recovery.restoreFromBackup(scope));

        assertEquals(1, repo.getCachedVideos(scope).size());
        assertEquals(T0, repo.getLastSyncTimestamp(scope));
        assertNotNull(store.get(CacheKeys.video(scope, "x")));
    }

    @Test
    void backupFailingChecksumIsNotRestored() {
        repo.saveVideosToCache(scope, List.of(Videos.done("a", "A", T0)));
        String backupKey = repo.createBackup(scope);
        JsonSerializer<CacheBackup> json = new JsonSerializer<>();
        CacheBackup taken = json.deserialize(store.get(backupKey), CacheBackup.class);
        SortedMap<String, byte[]> altered = new TreeMap<>(taken.entries());
        altered.put(CacheKeys.video(scope, "injected"), "{}".getBytes(StandardCharsets.UTF_8));
        store.set(backupKey, json.serialize(new CacheBackup(taken.scopeId(), taken.createdAt(), altered, taken.checksum())));
        repo.saveVideosToCache(scope, List.of(Videos.done("b", "A", T0)));

        assertFalse(recovery.restoreFromBackup(scope));

        assertNull(store.get(CacheKeys.video(scope, "injected")));
        assertEquals("b", repo.getCachedVideos(scope).get(0).videoId());
        assertEquals(1, repo.getCachedVideos(scope).size());
    }

    @Test
    void unreadableBackupIsNotRestored() {
        repo.saveVideosToCache(scope, List.of(Videos.done("a", "A", T0)));
        put(CacheKeys.backup(scope, T0.toEpochMilli()), "not json");

        assertFalse(recovery.restoreFromBackup(scope));
        assertEquals(1, repo.getCachedVideos(scope).size());
    }

    @Test
    void exactlyHalfBrokenIsRepairedNotReset() {
        repo.saveVideosToCache(scope, List.of(Videos.done("ok", "A", T0)));
        put(CacheKeys.video(scope, "x"), "{");

        RepairReport report = recovery.repair(scope);

        assertFalse(report.reset());
        assertEquals(1, report.removed());
        assertEquals(1, repo.getCachedVideos(scope).size());
    }

    @Test
    void processedWithoutSummaryIsDowngraded() {
        VideoRecord inconsistent = new VideoRecord("v", "A", "t", T0, T0, true, null, null);
        repo.saveVideosToCache(scope, List.of(inconsistent, Videos.done("w", "A", T0)));

        RepairReport report = recovery.repair(scope);

        assertTrue(report.success());
        assertEquals(1, report.downgraded());
        VideoRecord stored = repo.getCachedVideos(scope).stream()
                .filter(r -> r.videoId().equals("v")).findFirst().orElseThrow();
        assertFalse(stored.processed());
    }

    @Test
    void duplicateCopiesAreRemoved() {
        repo.saveVideosToCache(scope, List.of(Videos.done("a", "A", T0)));
        put(CacheKeys.video(scope, "zz-copy"), "{\"videoId\":\"a\",\"channelId\":\"A\",\"title\":\"t\"}");

        RepairReport report = recovery.repair(scope);

        assertTrue(report.success());
        assertEquals(1, report.removed());
        assertNull(store.get(CacheKeys.video(scope, "zz-copy")));
        assertNotNull(store.get(CacheKeys.video(scope, "a")));
    }

    @Test
    void storageFailureDuringRepairReportsFailure() {
        repo.saveVideosToCache(scope, List.of(Videos.done("a", "A", T0)));
        store.close();

        assertFalse(recovery.validateAndRepair(scope));
    }

    private void put(String key, String payload) {
        store.set(key, payload.getBytes(StandardCharsets.UTF_8));
    }
}
