package dev.summarycache.store;

import dev.summarycache.api.StorageUnavailableException;
import dev.summarycache.config.CacheConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.rocksdb.RocksDB;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.SortedSet;

import static org.junit.jupiter.api.Assertions.*;

class RocksKeyValueStoreTest {

    static { RocksDB.loadLibrary(); }

    private Path tmp;
    private CacheConfig config;
    private RocksKeyValueStore store;

    @BeforeEach
    void setUp() throws Exception {
        tmp = Files.createTempDirectory("summary-cache-store-");
        config = new CacheConfig().setBasePath(tmp.toString()).setStoreName("s1");
        store = new RocksKeyValueStore(config);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (store != null) store.close();
        if (tmp != null) {
            try {
                Files.walk(tmp)
                        .sorted((a, b) -> b.getNameCount() - a.getNameCount())
                        .forEach(p -> { try { Files.deleteIfExists(p); } catch (Exception ignored) {} });
            } catch (Exception ignored) {}
        }
    }

    @Test
    void getReturnsNullForAbsentKey() {
        assertNull(store.get("videos:42:missing"));
    }

    @Test
    void setGetDeleteRoundTrip() {
        store.set("scope:lastUser", bytes("42"));
        assertArrayEquals(bytes("42"), store.get("scope:lastUser"));
        store.delete("scope:lastUser");
        assertNull(store.get("scope:lastUser"));
    }

    @Test
    void listKeysReturnsOnlyPrefixMatchesInOrder() {
        store.set("videos:42:b", bytes("1"));
        store.set("videos:42:a", bytes("1"));
        store.set("videos:420:x", bytes("1"));
        store.set("channels:42:c", bytes("1"));

        SortedSet<String> keys = store.listKeys("videos:42:");
        assertEquals(List.of("videos:42:a", "videos:42:b"), List.copyOf(keys));
        assertTrue(store.listKeys("nothing:").isEmpty());
    }

    @Test
    void multiDeleteRemovesAllGivenKeys() {
        store.set("videos:42:a", bytes("1"));
        store.set("videos:42:b", bytes("1"));
        store.set("videos:42:c", bytes("1"));

        store.multiDelete(List.of("videos:42:a", "videos:42:c", "videos:42:zz"));

        assertEquals(List.of("videos:42:b"), List.copyOf(store.listKeys("videos:42:")));
    }

    @Test
    void dataSurvivesReopen() {
        store.set("sync:lastTimestamp:42", Utils.encodeLong(1234L));
        store.close();

        store = new RocksKeyValueStore(config);
        assertEquals(1234L, Utils.decodeLong(store.get("sync:lastTimestamp:42"), 0L));
    }

    @Test
    void closedStoreRejectsCallsAndCloseIsIdempotent() {
        store.close();
        store.close();
        assertTrue(store.isClosed());
        assertThrows(StorageUnavailableException.class, () -> store.get("k"));
        assertThrows(StorageUnavailableException.class, () -> store.set("k", bytes("v")));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
