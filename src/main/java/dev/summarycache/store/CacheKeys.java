package dev.summarycache.store;

import dev.summarycache.model.CacheScope;

/**
 * Logical key layout of the store.
 *
 * <pre>
 * videos:&lt;scope&gt;:&lt;videoId&gt;          one video record
 * channels:&lt;scope&gt;:&lt;channelId&gt;      one channel record
 * sync:lastTimestamp:&lt;scope&gt;         8-byte epoch millis
 * sync:channelChanged:&lt;scope&gt;        8-byte change generation, absent when unchanged
 * sync:channelsRefreshedAt:&lt;scope&gt;   8-byte epoch millis
 * validation:last:&lt;scope&gt;            last validation snapshot
 * backup:&lt;scope&gt;:&lt;millis&gt;          snapshot taken before a scope reset, millis zero-padded
 * tx:log:&lt;transactionId&gt;             transaction log entry
 * scope:lastUser                       owner of the active scope
 * </pre>
 */
public final class CacheKeys {
    private CacheKeys() {}

    public static final String VIDEOS = "videos:";
    public static final String CHANNELS = "channels:";
    public static final String TX_LOG = "tx:log:";
    public static final String SCOPE_LAST_USER = "scope:lastUser";

    private static final String LAST_SYNC = "sync:lastTimestamp:";
    private static final String CHANNEL_CHANGED = "sync:channelChanged:";
    private static final String CHANNELS_REFRESHED = "sync:channelsRefreshedAt:";
    private static final String LAST_VALIDATION = "validation:last:";
    private static final String BACKUP = "backup:";

    public static String videoPrefix(CacheScope scope) {
        return VIDEOS + scope.userId() + ":";
    }

    public static String video(CacheScope scope, String videoId) {
        return videoPrefix(scope) + videoId;
    }

    public static String channelPrefix(CacheScope scope) {
        return CHANNELS + scope.userId() + ":";
    }

    public static String channel(CacheScope scope, String channelId) {
        return channelPrefix(scope) + channelId;
    }

    public static String lastSync(CacheScope scope) {
        return LAST_SYNC + scope.userId();
    }

    public static String channelChanged(CacheScope scope) {
        return CHANNEL_CHANGED + scope.userId();
    }

    public static String channelsRefreshedAt(CacheScope scope) {
        return CHANNELS_REFRESHED + scope.userId();
    }

    public static String lastValidation(CacheScope scope) {
        return LAST_VALIDATION + scope.userId();
    }

    public static String backupPrefix(CacheScope scope) {
        return BACKUP + scope.userId() + ":";
    }

    /**
     * Backup keys sort by creation time within a scope.
     */
    public static String backup(CacheScope scope, long createdAtMillis) {
        return backupPrefix(scope) + String.format("%013d", createdAtMillis);
    }

    public static String txLog(String transactionId) {
        return TX_LOG + transactionId;
    }

    /**
     * Prefixes of the record collections owned by a scope. Each ends with the separator, so one scope id
     * never matches another that merely starts with it.
     */
    public static String[] recordPrefixes(CacheScope scope) {
        return new String[]{videoPrefix(scope), channelPrefix(scope)};
    }

    /**
     * Exact single-value keys owned by a scope.
     */
    public static String[] metaKeys(CacheScope scope) {
        return new String[]{
                lastSync(scope),
                channelChanged(scope),
                channelsRefreshedAt(scope),
                lastValidation(scope)
        };
    }

    /**
     * Extracts the owning scope id from a scoped key.
     *
     * @return the scope id, or null for keys that belong to no scope (transaction log, scope owner)
     */
    public static String scopeIdOf(String key) {
        for (String meta : new String[]{LAST_SYNC, CHANNEL_CHANGED, CHANNELS_REFRESHED, LAST_VALIDATION}) {
            if (key.startsWith(meta)) {
                return key.substring(meta.length());
            }
        }
        String rest = key.startsWith(BACKUP) ? key.substring(BACKUP.length()) : afterCollectionPrefix(key);
        if (rest == null) {
            return null;
        }
        int sep = rest.indexOf(':');
        return sep <= 0 ? null : rest.substring(0, sep);
    }

    /**
     * @return the record id part of a video or channel key, or null for any other key
     */
    public static String recordIdOf(String key) {
        String rest = afterCollectionPrefix(key);
        if (rest == null) {
            return null;
        }
        int sep = rest.indexOf(':');
        return sep < 0 ? null : rest.substring(sep + 1);
    }

    private static String afterCollectionPrefix(String key) {
        if (key.startsWith(VIDEOS)) {
            return key.substring(VIDEOS.length());
        }
        if (key.startsWith(CHANNELS)) {
            return key.substring(CHANNELS.length());
        }
        return null;
    }
}
