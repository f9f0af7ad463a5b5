package dev.summarycache.store;

import dev.summarycache.api.StorageUnavailableException;
import dev.summarycache.config.CacheConfig;
import org.rocksdb.Options;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;

import static dev.summarycache.store.Utils.sanitize;

/**
 * Persistent {@link KeyValueStore} backed by a single RocksDB instance.
 *
 * <p>Keys are UTF-8 strings, which keeps RocksDB's lexicographic order aligned with
 * {@link String#compareTo(String)} for the ASCII key layout of {@link CacheKeys}, so prefix scans are
 * a seek plus a bounded forward walk.
 *
 * <p><strong>Atomicity:</strong> {@code set} and {@code delete} are single-key atomic. {@code multiDelete}
 * is issued as one {@link WriteBatch}, but callers must not rely on that; the store contract only
 * promises per-key atomicity.
 *
 * <p><strong>Resource Management:</strong> Implements {@link AutoCloseable}; {@link #close()} releases the
 * native handles and is idempotent. Every call after close fails with
 * {@link StorageUnavailableException}.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * CacheConfig config = new CacheConfig().setBasePath("/tmp/summary-cache");
 * try (RocksKeyValueStore store = new RocksKeyValueStore(config)) {
 *     store.set("scope:lastUser", "42".getBytes(StandardCharsets.UTF_8));
 *     byte[] owner = store.get("scope:lastUser");
 * }
 * }</pre>
 */
public class RocksKeyValueStore implements KeyValueStore {
    private static final Logger logger = LoggerFactory.getLogger(RocksKeyValueStore.class);

    static { RocksDB.loadLibrary(); }

    private final String path;
    private final RocksDB db;
    private final WriteOptions writeOpts;
    private final ReadOptions readOpts;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Opens (creating if missing) the store at {@code basePath/storeName}.
     *
     * @param config the cache configuration
     * @throws StorageUnavailableException if the directory or RocksDB cannot be opened
     */
    public RocksKeyValueStore(CacheConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.path = config.getBasePath() + File.separator + sanitize(config.getStoreName());

        logger.info("Opening RocksDB store at path: {}", path);

        try {
            File dbDir = new File(path);
            if (!dbDir.exists() && !dbDir.mkdirs()) {
                throw new StorageUnavailableException("Failed to create directory: " + path);
            }

            // Use try-with-resources to ensure Options is properly closed
            try (Options options = new Options()
                    .setCreateIfMissing(true)
                    .setCompressionType(config.getCompressionType())
                    .setWriteBufferSize((long) config.getWriteBufferSizeMB() * 1024 * 1024)
                    .setMaxWriteBufferNumber(config.getMaxWriteBufferNumber())) {

                this.db = RocksDB.open(options, path);
            }
        } catch (RocksDBException e) {
            logger.error("Failed to open RocksDB at '{}': {}", path, e.getMessage(), e);
            throw new StorageUnavailableException("Failed to open RocksDB at " + path, e);
        }

        this.writeOpts = new WriteOptions()
                .setSync(config.isSyncWrites())
                .setDisableWAL(config.isDisableWAL());
        this.readOpts = new ReadOptions().setFillCache(true);

        logger.debug("Initialized RocksDB options - sync: {}, WAL disabled: {}",
                config.isSyncWrites(), config.isDisableWAL());
        logger.info("Successfully opened RocksDB store at path: {}", path);
    }

    @Override
    public byte[] get(String key) {
        ensureOpen();
        try {
            return db.get(readOpts, bytes(key));
        } catch (RocksDBException e) {
            logger.error("Failed to read key '{}': {}", key, e.getMessage(), e);
            throw new StorageUnavailableException("Failed to read key " + key, e);
        }
    }

    @Override
    public void set(String key, byte[] value) {
        ensureOpen();
        Objects.requireNonNull(value, "value cannot be null");
        try {
            db.put(writeOpts, bytes(key), value);
        } catch (RocksDBException e) {
            logger.error("Failed to write key '{}': {}", key, e.getMessage(), e);
            throw new StorageUnavailableException("Failed to write key " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        ensureOpen();
        try {
            db.delete(writeOpts, bytes(key));
        } catch (RocksDBException e) {
            logger.error("Failed to delete key '{}': {}", key, e.getMessage(), e);
            throw new StorageUnavailableException("Failed to delete key " + key, e);
        }
    }

    @Override
    public SortedSet<String> listKeys(String prefix) {
        ensureOpen();
        SortedSet<String> keys = new TreeSet<>();
        byte[] prefixBytes = bytes(prefix);
        try (RocksIterator it = db.newIterator(readOpts)) {
            it.seek(prefixBytes);
            while (it.isValid()) {
                String k = new String(it.key(), StandardCharsets.UTF_8);
                if (!k.startsWith(prefix)) break;
                keys.add(k);
                it.next();
            }
            it.status();
        } catch (RocksDBException e) {
            logger.error("Failed to scan prefix '{}': {}", prefix, e.getMessage(), e);
            throw new StorageUnavailableException("Failed to scan prefix " + prefix, e);
        }
        return keys;
    }

    @Override
    public void multiDelete(Collection<String> keys) {
        ensureOpen();
        if (keys.isEmpty()) {
            return;
        }
        try (WriteBatch batch = new WriteBatch()) {
            for (String k : keys) {
                batch.delete(bytes(k));
            }
            db.write(writeOpts, batch);
            logger.debug("Deleted {} keys in one batch", keys.size());
        } catch (RocksDBException e) {
            logger.error("Failed to delete {} keys: {}", keys.size(), e.getMessage(), e);
            throw new StorageUnavailableException("Failed to delete " + keys.size() + " keys", e);
        }
    }

    /**
     * Releases RocksDB resources. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            logger.debug("Close called on already closed store at '{}'", path);
            return;
        }

        logger.info("Closing RocksDB store at '{}'", path);

        try {
            readOpts.close();
        } catch (Exception e) {
            logger.warn("Failed to close read options for '{}': {}", path, e.getMessage(), e);
        }
        try {
            writeOpts.close();
        } catch (Exception e) {
            logger.warn("Failed to close write options for '{}': {}", path, e.getMessage(), e);
        }
        try {
            db.close();
            logger.info("Successfully closed RocksDB store at '{}'", path);
        } catch (Exception e) {
            logger.error("Failed to close RocksDB store at '{}': {}", path, e.getMessage(), e);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new StorageUnavailableException("Store is closed: " + path);
        }
    }

    private static byte[] bytes(String key) {
        return Objects.requireNonNull(key, "key cannot be null").getBytes(StandardCharsets.UTF_8);
    }
}
