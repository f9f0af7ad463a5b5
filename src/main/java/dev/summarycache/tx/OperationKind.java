package dev.summarycache.tx;

/**
 * What a transaction was doing, recorded in its log entry for diagnostics.
 */
public enum OperationKind {
    SAVE_VIDEOS,
    MERGE_VIDEOS,
    REMOVE_CHANNEL_VIDEOS,
    CLEAN_OLD_VIDEOS,
    SAVE_CHANNELS,
    SWITCH_SCOPE,
    CLEAR_SCOPE,
    REPAIR,
    BACKUP,
    RESTORE_BACKUP
}
