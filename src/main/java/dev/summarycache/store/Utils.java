package dev.summarycache.store;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

public final class Utils {
    private Utils() {}

    public static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9._-]", "_");
    }

    public static byte[] encodeLong(long value) {
        return ByteBuffer.allocate(8).order(ByteOrder.BIG_ENDIAN).putLong(value).array();
    }

    /**
     * @return the decoded value, or {@code fallback} if the bytes are absent or not exactly 8 long
     */
    public static long decodeLong(byte[] bytes, long fallback) {
        if (bytes == null || bytes.length != 8) {
            return fallback;
        }
        return ByteBuffer.wrap(bytes).order(ByteOrder.BIG_ENDIAN).getLong();
    }
}
