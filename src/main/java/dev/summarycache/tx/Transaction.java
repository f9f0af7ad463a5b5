package dev.summarycache.tx;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Handle for one transaction. Mutations are staged in memory and only reach the store on
 * {@link TransactionManager#commit(Transaction)}. Not thread-safe.
 */
public final class Transaction {
    private final String id;
    private final OperationKind kind;
    private final Instant startedAt;
    // null value = delete; insertion order is apply order
    private final Map<String, byte[]> staged = new LinkedHashMap<>();
    private volatile TransactionState state = TransactionState.PENDING;
    private List<KeyMutation> captured = List.of();
    private boolean commitStarted;

    Transaction(String id, OperationKind kind, Instant startedAt) {
        this.id = id;
        this.kind = kind;
        this.startedAt = startedAt;
    }

    public Transaction put(String key, byte[] value) {
        ensurePending();
        staged.remove(Objects.requireNonNull(key, "key cannot be null"));
        staged.put(key, Objects.requireNonNull(value, "value cannot be null"));
        return this;
    }

    public Transaction delete(String key) {
        ensurePending();
        staged.remove(Objects.requireNonNull(key, "key cannot be null"));
        staged.put(key, null);
        return this;
    }

    public String getId() {
        return id;
    }

    public OperationKind getKind() {
        return kind;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public TransactionState getState() {
        return state;
    }

    public int size() {
        return staged.size();
    }

    Map<String, byte[]> staged() {
        return Collections.unmodifiableMap(staged);
    }

    List<KeyMutation> captured() {
        return captured;
    }

    void captured(List<KeyMutation> mutations) {
        this.captured = List.copyOf(mutations);
    }

    boolean isCommitStarted() {
        return commitStarted;
    }

    void markCommitStarted() {
        this.commitStarted = true;
    }

    void state(TransactionState next) {
        this.state = next;
    }

    private void ensurePending() {
        if (state != TransactionState.PENDING) {
            throw new IllegalStateException("Transaction " + id + " is already " + state);
        }
        if (commitStarted) {
            throw new IllegalStateException("Transaction " + id + " is committing");
        }
    }
}
