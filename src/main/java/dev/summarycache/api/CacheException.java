package dev.summarycache.api;

/**
 * Base type for every failure raised by the cache engine.
 *
 * <p>Read paths never let these escape to callers; write, merge and sync paths propagate them so the
 * caller can keep its previous good state.
 */
public class CacheException extends RuntimeException {
    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
