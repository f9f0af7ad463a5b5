package dev.summarycache.tx;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of {@link TransactionManager#recoverIncompleteTransactions()}.
 *
 * @param inspected     pending entries found
 * @param notApplied    entries whose keys still held their pre-transaction values
 * @param applied       entries whose keys already held their post-transaction values
 * @param restored      entries that were half-applied and were put back to their pre-transaction values
 * @param discardedKeys keys that matched neither shape and were deleted
 */
public record RecoveryReport(int inspected, int notApplied, int applied, int restored, SortedSet<String> discardedKeys) {
    public RecoveryReport {
        discardedKeys = Collections.unmodifiableSortedSet(new TreeSet<>(discardedKeys));
    }

    public static RecoveryReport none() {
        return new RecoveryReport(0, 0, 0, 0, new TreeSet<>());
    }

    public boolean isClean() {
        return inspected == 0;
    }
}
