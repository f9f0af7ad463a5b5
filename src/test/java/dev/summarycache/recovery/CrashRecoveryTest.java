package dev.summarycache.recovery;

import dev.summarycache.api.CacheException;
import dev.summarycache.client.SummaryCacheClient;
import dev.summarycache.config.CacheConfig;
import dev.summarycache.core.CacheRepository;
import dev.summarycache.model.CacheScope;
import dev.summarycache.model.VideoRecord;
import dev.summarycache.store.CacheKeys;
import dev.summarycache.store.InMemoryKeyValueStore;
import dev.summarycache.store.RocksKeyValueStore;
import dev.summarycache.testing.CrashingKeyValueStore;
import dev.summarycache.testing.FakeSummaryApi;
import dev.summarycache.testing.Videos;
import dev.summarycache.tx.OperationKind;
import dev.summarycache.tx.RecoveryReport;
import dev.summarycache.tx.TransactionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.rocksdb.RocksDB;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CrashRecoveryTest {

    static { RocksDB.loadLibrary(); }

    private Path tmp;
    private SummaryCacheClient client;

    @AfterEach
    void tearDown() throws Exception {
        if (client != null) client.close();
        if (tmp != null) {
            try {
                Files.walk(tmp)
                        .sorted((a, b) -> b.getNameCount() - a.getNameCount())
                        .forEach(p -> { try { Files.deleteIfExists(p); } catch (Exception ignored) {} });
            } catch (Exception ignored) {}
        }
    }

    @Test
    void everyCrashPointRecoversToFullyOldOrFullyNew() {
        // begin, log rewrite, three mutations, log delete
        for (int crashAfter = 0; crashAfter <= 6; crashAfter++) {
            InMemoryKeyValueStore disk = new InMemoryKeyValueStore();
            disk.set("a", bytes("a0"));
            disk.set("b", bytes("b0"));

            CrashingKeyValueStore crashing = new CrashingKeyValueStore(disk, crashAfter);
            try {
                new TransactionManager(crashing).inTransaction(OperationKind.MERGE_VIDEOS, tx -> {
                    tx.put("a", bytes("a1")).delete("b").put("c", bytes("c1"));
                    return null;
                });
            } catch (CacheException expected) {
                assertTrue(crashing.hasCrashed(), "crash point " + crashAfter);
            }

            RecoveryReport report = new TransactionManager(disk).recoverIncompleteTransactions();

            boolean old = "a0".equals(str(disk.get("a"))) && "b0".equals(str(disk.get("b"))) && disk.get("c") == null;
            boolean fresh = "a1".equals(str(disk.get("a"))) && disk.get("b") == null && "c1".equals(str(disk.get("c")));
            assertTrue(old || fresh, "crash point " + crashAfter + " left a partial write");
            assertTrue(report.discardedKeys().isEmpty());
            assertTrue(disk.listKeys(CacheKeys.TX_LOG).isEmpty());
            disk.close();
        }
    }

    @Test
    void halfAppliedTransactionIsRestored() {
        InMemoryKeyValueStore disk = new InMemoryKeyValueStore();
        disk.set("a", bytes("a0"));
        CrashingKeyValueStore crashing = new CrashingKeyValueStore(disk, 3);

        assertThrows(CacheException.class, () -> new TransactionManager(crashing).inTransaction(OperationKind.SAVE_VIDEOS, tx -> {
            tx.put("a", bytes("a1")).put("b", bytes("b1"));
            return null;
        }));
        assertEquals("a1", str(disk.get("a")));

        RecoveryReport report = new TransactionManager(disk).recoverIncompleteTransactions();

        assertEquals(1, report.inspected());
        assertEquals(1, report.restored());
        assertEquals("a0", str(disk.get("a")));
        assertNull(disk.get("b"));
    }

    @Test
    void unrecognizableDataIsDiscardedAndReported() {
        InMemoryKeyValueStore disk = new InMemoryKeyValueStore();
        CacheScope scope = CacheScope.of("42");
        String a = CacheKeys.video(scope, "a");
        String b = CacheKeys.video(scope, "b");
        disk.set(a, bytes("a0"));
        CrashingKeyValueStore crashing = new CrashingKeyValueStore(disk, 3);

        assertThrows(CacheException.class, () -> new TransactionManager(crashing).inTransaction(OperationKind.SAVE_VIDEOS, tx -> {
            tx.put(a, bytes("a1")).put(b, bytes("b1"));
            return null;
        }));
        disk.set(a, bytes("torn"));

        RecoveryReport report = new TransactionManager(disk).recoverIncompleteTransactions();

        assertEquals(Set.of(a, b), report.discardedKeys());
        assertNull(disk.get(a));
        assertNull(disk.get(b));
        assertTrue(disk.listKeys(CacheKeys.TX_LOG).isEmpty());
    }

    @Test
    void interruptedMergeIsHealedAcrossRocksDbRestart() throws Exception {
        tmp = Files.createTempDirectory("summary-cache-crash-");
        CacheConfig config = new CacheConfig().setBasePath(tmp.toString()).setValidateOnStartup(true);
        CacheScope scope = CacheScope.of("42");
        Instant t0 = Instant.parse("2024-05-01T00:00:00Z");

        RocksKeyValueStore disk = new RocksKeyValueStore(config);
        CacheRepository first = new CacheRepository(disk, new TransactionManager(disk), config, null);
        first.checkUserChanged(scope);
        first.saveVideosToCache(scope, List.of(Videos.done("v1", "A", t0), Videos.done("v2", "A", t0.plusSeconds(1))));

        CrashingKeyValueStore crashing = new CrashingKeyValueStore(disk, 3);
        CacheRepository dying = new CacheRepository(crashing, new TransactionManager(crashing), config, null);
        List<VideoRecord> incoming = List.of(
                Videos.done("v3", "B", t0.plusSeconds(2)),
                Videos.done("v4", "B", t0.plusSeconds(3)),
                Videos.done("v5", "B", t0.plusSeconds(4)));
        assertThrows(CacheException.class, () -> dying.mergeVideos(scope, incoming, t0.plusSeconds(10)));
        disk.close();

        client = SummaryCacheClient.open(config, new FakeSummaryApi());

        assertEquals(1, client.getStartupRecovery().inspected());
        Set<String> ids = client.getCachedVideos().stream().map(VideoRecord::videoId).collect(Collectors.toSet());
        assertEquals(Set.of("v1", "v2"), ids);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String str(byte[] b) {
        return b == null ? null : new String(b, StandardCharsets.UTF_8);
    }
}
