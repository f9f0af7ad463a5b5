package dev.summarycache.api;

public class RemoteFetchFailedException extends CacheException {
    public RemoteFetchFailedException(String message) {
        super(message);
    }

    public RemoteFetchFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
