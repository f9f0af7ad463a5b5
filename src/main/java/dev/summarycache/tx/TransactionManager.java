package dev.summarycache.tx;

import dev.summarycache.api.StorageUnavailableException;
import dev.summarycache.api.TransactionInterruptedException;
import dev.summarycache.ser.JsonSerializer;
import dev.summarycache.ser.Serializer;
import dev.summarycache.store.CacheKeys;
import dev.summarycache.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.zip.CRC32;

/**
 * Multi-key writes over a store that is only atomic per key.
 *
 * <p>Lifecycle of a transaction:
 * <ul>
 *   <li>{@link #begin(OperationKind)} writes a {@code pending} log entry before any data key is touched</li>
 *   <li>{@link #commit(Transaction)} rewrites the entry with the pre-image of every staged key, applies the
 *       mutations in order, then deletes the entry. The absence of the entry is the committed marker.</li>
 *   <li>{@link #rollback(Transaction)} puts back every pre-image and deletes the entry</li>
 *   <li>an entry left behind by a dead process is resolved by {@link #recoverIncompleteTransactions()}</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> A {@link Transaction} belongs to one thread. Writers are expected to be
 * serialized by the caller; this class holds no lock of its own.
 */
public class TransactionManager {
    private static final Logger logger = LoggerFactory.getLogger(TransactionManager.class);

    private final KeyValueStore store;
    private final Clock clock;
    private final Serializer<TransactionLogEntry> serializer = new JsonSerializer<>();

    public TransactionManager(KeyValueStore store) {
        this(store, null);
    }

    /**
     * @param store the store to write through
     * @param clock the clock for {@code startedAt}, null for system UTC
     */
    public TransactionManager(KeyValueStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.clock = (clock != null) ? clock : Clock.systemUTC();
    }

    /**
     * Starts a transaction and durably logs it as pending.
     *
     * @throws StorageUnavailableException if the log entry cannot be written
     */
    public Transaction begin(OperationKind kind) {
        Objects.requireNonNull(kind, "kind cannot be null");
        Transaction tx = new Transaction(UUID.randomUUID().toString(), kind, clock.instant());
        writeLog(tx, List.of());
        logger.debug("Transaction {} began ({})", tx.getId(), kind);
        return tx;
    }

    /**
     * Applies every staged mutation and clears the log entry.
     *
     * <p>On failure the pre-images are restored and the original exception is rethrown. If restoring fails
     * too, the log entry is left pending for startup recovery and
     * {@link TransactionInterruptedException} is thrown.
     */
    public void commit(Transaction tx) {
        ensurePending(tx);
        tx.markCommitStarted();
        Map<String, byte[]> staged = tx.staged();

        if (staged.isEmpty()) {
            store.delete(CacheKeys.txLog(tx.getId()));
            tx.state(TransactionState.COMMITTED);
            logger.debug("Committed empty transaction {}", tx.getId());
            return;
        }

        long start = clock.millis();
        try {
            List<KeyMutation> mutations = new ArrayList<>(staged.size());
            for (Map.Entry<String, byte[]> e : staged.entrySet()) {
                byte[] after = e.getValue();
                mutations.add(new KeyMutation(e.getKey(), store.get(e.getKey()), after == null ? null : crc(after)));
            }
            tx.captured(mutations);
            writeLog(tx, mutations);

            for (Map.Entry<String, byte[]> e : staged.entrySet()) {
                if (e.getValue() == null) {
                    store.delete(e.getKey());
                } else {
                    store.set(e.getKey(), e.getValue());
                }
            }

            store.delete(CacheKeys.txLog(tx.getId()));
            tx.state(TransactionState.COMMITTED);
            logger.debug("Committed transaction {} ({}) with {} mutations in {}ms",
                    tx.getId(), tx.getKind(), staged.size(), clock.millis() - start);
        } catch (RuntimeException e) {
            logger.error("Commit of transaction {} ({}) failed, rolling back: {}",
                    tx.getId(), tx.getKind(), e.getMessage(), e);
            try {
                restore(tx);
            } catch (RuntimeException rollbackFailure) {
                logger.error("Rollback of transaction {} failed, leaving it for startup recovery: {}",
                        tx.getId(), rollbackFailure.getMessage(), rollbackFailure);
                TransactionInterruptedException interrupted = new TransactionInterruptedException(tx.getId(), e);
                interrupted.addSuppressed(rollbackFailure);
                throw interrupted;
            }
            throw e;
        }
    }

    /**
     * Discards the transaction. Keys already written by a failed commit are put back to their pre-images.
     * No-op for transactions that are no longer pending.
     */
    public void rollback(Transaction tx) {
        Objects.requireNonNull(tx, "tx cannot be null");
        if (tx.getState() != TransactionState.PENDING) {
            logger.warn("Rollback ignored for transaction {} in state {}", tx.getId(), tx.getState());
            return;
        }
        restore(tx);
    }

    /**
     * Runs {@code work} inside a transaction: begin on entry, commit on normal return, rollback when
     * {@code work} throws. The transaction is released on every exit path.
     */
    public <R> R inTransaction(OperationKind kind, TransactionWork<R> work) {
        Transaction tx = begin(kind);
        R result;
        try {
            result = work.apply(tx);
        } catch (RuntimeException e) {
            try {
                rollback(tx);
            } catch (RuntimeException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        }
        commit(tx);
        return result;
    }

    /**
     * Resolves every transaction a previous process left pending. Must run before the cache serves its
     * first read.
     *
     * <p>Each key of a pending entry is compared against its pre-image and its post-image fingerprint:
     * <ul>
     *   <li>all keys old: the commit never started applying, nothing to do</li>
     *   <li>all keys new: the commit applied fully but died before clearing the log</li>
     *   <li>a mix of old and new: pre-images are restored</li>
     *   <li>any key matching neither: every target key is deleted and reported in
     *       {@link RecoveryReport#discardedKeys()} so the owner can force a full sync</li>
     * </ul>
     * The log entry is deleted in every case.
     */
    public RecoveryReport recoverIncompleteTransactions() {
        logger.info("Checking for incomplete cache transactions");
        SortedSet<String> logKeys = store.listKeys(CacheKeys.TX_LOG);
        if (logKeys.isEmpty()) {
            logger.debug("No transaction logs found");
            return RecoveryReport.none();
        }

        int inspected = 0;
        int notApplied = 0;
        int applied = 0;
        int restored = 0;
        SortedSet<String> discarded = new TreeSet<>();

        for (String logKey : logKeys) {
            TransactionLogEntry entry;
            try {
                byte[] raw = store.get(logKey);
                entry = raw == null ? null : serializer.deserialize(raw, TransactionLogEntry.class);
            } catch (StorageUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                logger.warn("Unreadable transaction log '{}', dropping it: {}", logKey, e.getMessage());
                store.delete(logKey);
                continue;
            }
            if (entry == null) {
                continue;
            }
            if (entry.state() != TransactionState.PENDING) {
                logger.debug("Dropping stale {} log entry {}", entry.state(), entry.transactionId());
                store.delete(logKey);
                continue;
            }

            inspected++;
            boolean allOld = true;
            boolean allNew = true;
            boolean unknown = false;
            for (KeyMutation m : entry.mutations()) {
                byte[] current = store.get(m.key());
                boolean isOld = Arrays.equals(current, m.before());
                boolean isNew = m.afterCrc() == null ? current == null : current != null && crc(current) == m.afterCrc();
                allOld &= isOld;
                allNew &= isNew;
                unknown |= !isOld && !isNew;
            }

            if (unknown) {
                List<String> targets = entry.mutations().stream().map(KeyMutation::key).collect(Collectors.toList());
                logger.warn("Interrupted transaction {} ({}) left unrecognizable data, discarding {} keys",
                        entry.transactionId(), entry.operationKind(), targets.size());
                store.multiDelete(targets);
                discarded.addAll(targets);
            } else if (allOld) {
                logger.info("Interrupted transaction {} ({}) never applied, nothing to undo",
                        entry.transactionId(), entry.operationKind());
                notApplied++;
            } else if (allNew) {
                logger.info("Interrupted transaction {} ({}) fully applied, keeping its data",
                        entry.transactionId(), entry.operationKind());
                applied++;
            } else {
                logger.warn("Interrupted transaction {} ({}) was half-applied, restoring {} pre-images",
                        entry.transactionId(), entry.operationKind(), entry.mutations().size());
                applyPreImages(entry.mutations());
                restored++;
            }
            store.delete(logKey);
        }

        RecoveryReport report = new RecoveryReport(inspected, notApplied, applied, restored, discarded);
        if (inspected > 0) {
            logger.warn("Recovered {} interrupted transactions (not applied: {}, applied: {}, restored: {}, discarded keys: {})",
                    inspected, notApplied, applied, restored, discarded.size());
        }
        return report;
    }

    private void restore(Transaction tx) {
        if (tx.isCommitStarted()) {
            applyPreImages(tx.captured());
        }
        store.delete(CacheKeys.txLog(tx.getId()));
        tx.state(TransactionState.ROLLED_BACK);
        logger.info("Rolled back transaction {} ({})", tx.getId(), tx.getKind());
    }

    private void applyPreImages(List<KeyMutation> mutations) {
        for (KeyMutation m : mutations) {
            if (m.before() == null) {
                store.delete(m.key());
            } else {
                store.set(m.key(), m.before());
            }
        }
    }

    private void writeLog(Transaction tx, List<KeyMutation> mutations) {
        TransactionLogEntry entry = new TransactionLogEntry(
                tx.getId(), tx.getKind(), mutations, tx.getStartedAt(), TransactionState.PENDING);
        store.set(CacheKeys.txLog(tx.getId()), serializer.serialize(entry));
    }

    private static void ensurePending(Transaction tx) {
        Objects.requireNonNull(tx, "tx cannot be null");
        if (tx.getState() != TransactionState.PENDING || tx.isCommitStarted()) {
            throw new IllegalStateException("Transaction " + tx.getId() + " is not active (" + tx.getState() + ")");
        }
    }

    static long crc(byte[] bytes) {
        CRC32 c = new CRC32();
        c.update(bytes, 0, bytes.length);
        return c.getValue();
    }
}
