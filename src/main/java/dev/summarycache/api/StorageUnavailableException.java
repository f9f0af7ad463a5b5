package dev.summarycache.api;

/**
 * The device storage backend could not be reached. Fatal for the current operation only.
 */
public class StorageUnavailableException extends CacheException {
    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
