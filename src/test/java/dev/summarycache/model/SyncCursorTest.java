package dev.summarycache.model;

import dev.summarycache.api.InvalidScopeException;
import dev.summarycache.testing.Videos;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyncCursorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    @Test
    void cursorPointsAtOldestRecordWithIdTieBreak() {
        SyncCursor cursor = SyncCursor.fromVideos(List.of(
                Videos.done("b", "A", T0),
                Videos.done("z", "A", T0.plusSeconds(10)),
                Videos.done("a", "A", T0)));

        assertEquals(T0.toEpochMilli(), cursor.lastCreatedAtMillis());
        assertEquals("a", cursor.lastVideoId());
        assertEquals(T0.toEpochMilli() + "_a", cursor.encode());
    }

    @Test
    void emptyPageHasNoCursor() {
        assertNull(SyncCursor.fromVideos(List.of()));
    }

    @Test
    void decodeKeepsUnderscoresInVideoId() {
        SyncCursor cursor = SyncCursor.decode("1714521600000_abc_def");
        assertEquals(1714521600000L, cursor.lastCreatedAtMillis());
        assertEquals("abc_def", cursor.lastVideoId());
    }

    @Test
    void decodeRejectsMalformedTokens() {
        assertThrows(IllegalArgumentException.class, () -> SyncCursor.decode("nounderscore"));
        assertThrows(IllegalArgumentException.class, () -> SyncCursor.decode("abc_v1"));
        assertThrows(IllegalArgumentException.class, () -> SyncCursor.decode("123_"));
    }

    @Test
    void recordWithoutCreatedAtOrdersAsOldest() {
        VideoRecord legacy = new VideoRecord("legacy", "A", "t", null, null, false, null, null);
        SyncCursor cursor = SyncCursor.fromVideos(List.of(Videos.done("new", "A", T0), legacy));
        assertEquals("legacy", cursor.lastVideoId());
        assertEquals(ProcessingStatus.PENDING, legacy.processingStatus());
    }

    @Test
    void scopeRejectsSeparatorAndBlank() {
        assertEquals("42", CacheScope.of(" 42 ").userId());
        assertThrows(InvalidScopeException.class, () -> CacheScope.of("4:2"));
        assertThrows(InvalidScopeException.class, () -> CacheScope.of(""));
        assertThrows(InvalidScopeException.class, () -> CacheScope.of(null));
    }
}
