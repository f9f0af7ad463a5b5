package dev.summarycache.core;

import dev.summarycache.model.CacheScope;
import dev.summarycache.store.CacheKeys;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The effect of admitting {@code next} as the active scope when {@code previousOwner} owned the cache.
 *
 * @param previousOwner user id stored as the cache owner, null on a fresh store
 * @param next          the scope being admitted
 * @param keysToClear   keys that must be deleted before {@code next} may be written
 */
public record ScopeTransition(String previousOwner, CacheScope next, SortedSet<String> keysToClear) {

    public ScopeTransition {
        Objects.requireNonNull(next, "next cannot be null");
        keysToClear = Collections.unmodifiableSortedSet(new TreeSet<>(keysToClear));
    }

    /**
     * Pure decision over the keys currently present. When the owner differs from {@code next} (including
     * a store with no owner yet) every key of either scope is cleared, so stale data of an earlier session
     * of {@code next} is never mixed with fresh data. Keys of other scopes and unscoped keys are untouched.
     */
    public static ScopeTransition clearAndReseed(String previousOwner, CacheScope next, Collection<String> existingKeys) {
        Objects.requireNonNull(next, "next cannot be null");
        SortedSet<String> clear = new TreeSet<>();
        if (!next.userId().equals(previousOwner)) {
            for (String key : existingKeys) {
                String owner = CacheKeys.scopeIdOf(key);
                if (owner != null && (owner.equals(previousOwner) || owner.equals(next.userId()))) {
                    clear.add(key);
                }
            }
        }
        return new ScopeTransition(previousOwner, next, clear);
    }

    public boolean isChange() {
        return !next.userId().equals(previousOwner);
    }
}
