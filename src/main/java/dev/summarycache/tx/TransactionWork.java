package dev.summarycache.tx;

@FunctionalInterface
public interface TransactionWork<R> {
    R apply(Transaction tx);
}
