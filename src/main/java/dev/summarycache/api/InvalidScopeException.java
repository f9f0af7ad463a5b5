package dev.summarycache.api;

public class InvalidScopeException extends CacheException {
    public InvalidScopeException(String message) {
        super(message);
    }
}
