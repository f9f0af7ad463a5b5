package dev.summarycache.tx;

import java.util.Objects;

/**
 * One key touched by a transaction.
 *
 * @param key      target key
 * @param before   value before the transaction, null when the key was absent
 * @param afterCrc CRC32 of the value the transaction writes, null when it deletes the key
 */
public record KeyMutation(String key, byte[] before, Long afterCrc) {
    public KeyMutation {
        Objects.requireNonNull(key, "key cannot be null");
    }
}
