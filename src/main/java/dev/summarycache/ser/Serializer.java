package dev.summarycache.ser;

/**
 * Converts stored values to and from the bytes kept in the {@link dev.summarycache.store.KeyValueStore}.
 *
 * <p>{@code deserialize} throws an unchecked exception for a payload it cannot decode; callers on read
 * paths treat that as a corrupt record.
 */
public interface Serializer<T> {
    byte[] serialize(T value);

    T deserialize(byte[] bytes, Class<T> type);
}
