package dev.summarycache.api;

import java.time.Instant;

/**
 * @param since     only records created after this instant; null requests the newest page
 * @param limit     maximum records to return
 * @param paginated whether the response should carry a {@code nextCursor}
 */
public record VideoPageRequest(Instant since, int limit, boolean paginated) {
    public VideoPageRequest {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
    }
}
