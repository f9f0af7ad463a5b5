package dev.summarycache.store;

import dev.summarycache.api.StorageUnavailableException;

import java.util.Collection;
import java.util.SortedSet;

/**
 * Durable key-value primitive underneath the cache.
 *
 * <p>Every operation is atomic for a single key only. Nothing here spans keys; multi-key consistency
 * is the job of {@link dev.summarycache.tx.TransactionManager}.
 *
 * <p>All methods throw {@link StorageUnavailableException} when the backend cannot be reached or the
 * store has been closed.
 */
public interface KeyValueStore extends AutoCloseable {

    /**
     * @return a copy of the stored bytes, or null when the key is absent
     */
    byte[] get(String key);

    void set(String key, byte[] value);

    void delete(String key);

    /**
     * @return keys starting with {@code prefix}, in ascending order
     */
    SortedSet<String> listKeys(String prefix);

    void multiDelete(Collection<String> keys);

    @Override
    void close();
}
