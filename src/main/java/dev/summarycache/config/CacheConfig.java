package dev.summarycache.config;

import org.rocksdb.CompressionType;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

@Getter
@Setter
@Accessors(chain = true)
public class CacheConfig {
    // System property helpers for test configurability (safe fallbacks)
    private static String prop(String key, String def) {
        String v = System.getProperty(key);
        return v == null ? def : v;
    }
    private static boolean boolProp(String key, boolean def) {
        String v = System.getProperty(key);
        return v == null ? def : Boolean.parseBoolean(v);
    }
    private static int intProp(String key, int def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Integer.parseInt(v); } catch (NumberFormatException e) { return def; }
    }
    private static double doubleProp(String key, double def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Double.parseDouble(v); } catch (NumberFormatException e) { return def; }
    }

    // Paths
    private String basePath = prop("sc.basePath", "./data/summary-cache");
    private String storeName = prop("sc.storeName", "default");

    // RocksDB
    private boolean syncWrites = false;       // WAL fsync on each write
    private boolean disableWAL = false;       // keep WAL by default
    private int writeBufferSizeMB = 16;       // per memtable, the working set is small
    private int maxWriteBufferNumber = 2;
    private CompressionType compressionType = CompressionType.LZ4_COMPRESSION;

    // Sync behavior
    private int fullSyncPageSize = intProp("sc.fullSyncPageSize", 50);
    private int channelRefreshIntervalHours = intProp("sc.channelRefreshIntervalHours", 72);

    // Working set
    private int maxCachedVideos = intProp("sc.maxCachedVideos", 500);
    private boolean retentionEnabled = boolProp("sc.retentionEnabled", false); // off keeps the full summary history
    private int retentionDays = intProp("sc.retentionDays", 7);

    // Validation and recovery
    private double criticalResetFraction = doubleProp("sc.criticalResetFraction", 0.5); // strictly more than this clears the scope
    private long futureTimestampToleranceMs = 60_000L;
    private boolean validateOnStartup = boolProp("sc.validateOnStartup", true);
    private int validationIntervalHours = intProp("sc.validationIntervalHours", 24); // 0 disables revalidation during sync
    private int maxBackups = intProp("sc.maxBackups", 3);
}
