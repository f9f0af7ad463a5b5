package dev.summarycache.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.zip.CRC32;

/**
 * Raw copy of a scope's records and sync metadata, taken before the scope is reset.
 *
 * @param scopeId   owner of the copied keys
 * @param createdAt when the copy was taken
 * @param entries   stored key to stored bytes
 * @param checksum  CRC32 over {@code entries} in key order, computed when the copy was taken
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheBackup(String scopeId, Instant createdAt, SortedMap<String, byte[]> entries, long checksum) {

    public CacheBackup {
        Objects.requireNonNull(scopeId, "scopeId cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        entries = entries == null ? new TreeMap<>() : new TreeMap<>(entries);
    }

    public static CacheBackup of(String scopeId, Instant createdAt, Map<String, byte[]> entries) {
        SortedMap<String, byte[]> sorted = new TreeMap<>(entries);
        return new CacheBackup(scopeId, createdAt, sorted, checksumOf(sorted));
    }

    /**
     * @return true when the entries still match the checksum recorded at creation
     */
    @JsonIgnore
    public boolean isIntact() {
        return checksum == checksumOf(entries);
    }

    static long checksumOf(SortedMap<String, byte[]> entries) {
        CRC32 crc = new CRC32();
        for (Map.Entry<String, byte[]> e : entries.entrySet()) {
            byte[] key = e.getKey().getBytes(StandardCharsets.UTF_8);
            crc.update(key, 0, key.length);
            crc.update(0);
            byte[] value = e.getValue();
            if (value != null) {
                crc.update(value, 0, value.length);
            }
            crc.update(0);
        }
        return crc.getValue();
    }
}
