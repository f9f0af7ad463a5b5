package dev.summarycache.api;

/**
 * A sync could neither refresh from the remote source nor fall back to a non-empty cached set.
 */
public class SyncFailedException extends CacheException {
    public SyncFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
