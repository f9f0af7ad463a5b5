package dev.summarycache.api;

/**
 * A commit failed and so did its rollback. The transaction log entry stays pending and is resolved by
 * {@code recoverIncompleteTransactions()} on the next start.
 */
public class TransactionInterruptedException extends CacheException {
    private final String transactionId;

    public TransactionInterruptedException(String transactionId, Throwable cause) {
        super("Transaction " + transactionId + " left pending after failed commit and rollback", cause);
        this.transactionId = transactionId;
    }

    public String getTransactionId() {
        return transactionId;
    }
}
