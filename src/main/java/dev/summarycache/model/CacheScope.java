package dev.summarycache.model;

import dev.summarycache.api.InvalidScopeException;

import java.util.regex.Pattern;

/**
 * The authenticated-user partition of the cache. Passed explicitly into every repository call.
 */
public record CacheScope(String userId) {
    private static final Pattern USER_ID = Pattern.compile("[A-Za-z0-9._@-]{1,128}");

    public CacheScope {
        if (userId == null || !USER_ID.matcher(userId).matches()) {
            throw new InvalidScopeException("Malformed user id: " + userId);
        }
    }

    public static CacheScope of(String userId) {
        return new CacheScope(userId == null ? null : userId.trim());
    }

    @Override
    public String toString() {
        return userId;
    }
}
