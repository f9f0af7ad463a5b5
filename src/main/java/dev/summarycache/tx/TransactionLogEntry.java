package dev.summarycache.tx;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Durable record of an in-flight transaction, stored under {@code tx:log:<transactionId>}.
 *
 * <p>Written with state {@link TransactionState#PENDING} before any data key is touched and deleted once
 * the transaction completes. An entry that survives a restart marks an interrupted write. The
 * {@code mutations} carry the pre-images recovery needs to put keys back.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransactionLogEntry(
        String transactionId,
        OperationKind operationKind,
        List<KeyMutation> mutations,
        Instant startedAt,
        TransactionState state
) {
    public TransactionLogEntry {
        Objects.requireNonNull(transactionId, "transactionId cannot be null");
        Objects.requireNonNull(state, "state cannot be null");
        mutations = mutations == null ? List.of() : List.copyOf(mutations);
    }
}
