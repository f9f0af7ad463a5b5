package dev.summarycache.ser;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Raw UTF-8 for plain string values such as the scope owner, so they stay readable with any RocksDB tool.
 */
public class Utf8StringSerializer implements Serializer<String> {
    @Override
    public byte[] serialize(String value) {
        return Objects.requireNonNull(value, "value cannot be null").getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String deserialize(byte[] bytes, Class<String> type) {
        return new String(Objects.requireNonNull(bytes, "bytes cannot be null"), StandardCharsets.UTF_8).trim();
    }
}
