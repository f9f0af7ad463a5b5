package dev.summarycache.api;

/**
 * A stored payload could not be decoded or lacks a required field.
 */
public class CorruptRecordException extends CacheException {
    private final String key;

    public CorruptRecordException(String key, String message, Throwable cause) {
        super(message + " (key=" + key + ")", cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
