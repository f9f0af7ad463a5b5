package dev.summarycache.model;

import java.time.Instant;

/**
 * Derived view over the current collection of one scope. Never stored.
 *
 * @param totalEntries             number of readable video records
 * @param approximateSizeBytes     sum of the stored payload sizes
 * @param lastSyncTimestamp        last successful sync, {@link Instant#EPOCH} when never synced
 * @param validationStatus         outcome of the last validation run
 * @param oldestEntryTimestamp     oldest {@code createdAt}, null for an empty cache
 * @param newestEntryTimestamp     newest {@code createdAt}, null for an empty cache
 * @param lastValidationTimestamp  when validation last ran, {@link Instant#EPOCH} when never
 */
public record CacheStats(
        int totalEntries,
        long approximateSizeBytes,
        Instant lastSyncTimestamp,
        ValidationStatus validationStatus,
        Instant oldestEntryTimestamp,
        Instant newestEntryTimestamp,
        Instant lastValidationTimestamp
) {
    public static CacheStats empty() {
        return new CacheStats(0, 0L, Instant.EPOCH, ValidationStatus.HEALTHY, null, null, Instant.EPOCH);
    }
}
