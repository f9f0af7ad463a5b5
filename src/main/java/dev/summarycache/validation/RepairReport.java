package dev.summarycache.validation;

/**
 * Outcome of {@link CacheRecovery#repair(dev.summarycache.model.CacheScope)}.
 *
 * @param success    true when no critical issue remains
 * @param removed    records deleted
 * @param downgraded records whose {@code processed} flag was cleared
 * @param reset      true when the whole scope was cleared and a full sync forced
 */
public record RepairReport(boolean success, int removed, int downgraded, boolean reset) {

    static RepairReport failed() {
        return new RepairReport(false, 0, 0, false);
    }
}
