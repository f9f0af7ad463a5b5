package dev.summarycache.store;

import dev.summarycache.api.StorageUnavailableException;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Simple in-memory implementation backed by a skip list. Nothing survives {@link #close()}.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {
    private final ConcurrentNavigableMap<String, byte[]> data = new ConcurrentSkipListMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    @Override
    public byte[] get(String key) {
        ensureOpen();
        byte[] v = data.get(Objects.requireNonNull(key, "key cannot be null"));
        return v == null ? null : Arrays.copyOf(v, v.length);
    }

    @Override
    public void set(String key, byte[] value) {
        ensureOpen();
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        data.put(key, Arrays.copyOf(value, value.length));
    }

    @Override
    public void delete(String key) {
        ensureOpen();
        data.remove(Objects.requireNonNull(key, "key cannot be null"));
    }

    @Override
    public SortedSet<String> listKeys(String prefix) {
        ensureOpen();
        SortedSet<String> keys = new TreeSet<>();
        for (String k : data.tailMap(prefix, true).keySet()) {
            if (!k.startsWith(prefix)) break;
            keys.add(k);
        }
        return keys;
    }

    @Override
    public void multiDelete(Collection<String> keys) {
        ensureOpen();
        for (String k : keys) {
            data.remove(k);
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            data.clear();
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new StorageUnavailableException("In-memory store is closed");
        }
    }
}
