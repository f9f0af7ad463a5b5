package dev.summarycache.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * A video summary as held in the local cache.
 *
 * <p>{@code createdAt} is when the record entered the system and drives sync windows and ordering;
 * {@code publishedAt} is the upstream publication time and is display-only.
 *
 * @param videoId          stable identity
 * @param channelId        owning channel
 * @param title            display title, may be null for optimistically cached records
 * @param publishedAt      upstream publication time, may be null
 * @param createdAt        ingestion time, may be null for legacy payloads (ordered as epoch)
 * @param processed        whether summarization completed
 * @param summary          summary text, required when {@code processed}
 * @param processingStatus pipeline state, defaults to {@link ProcessingStatus#PENDING}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VideoRecord(
        String videoId,
        String channelId,
        String title,
        Instant publishedAt,
        Instant createdAt,
        boolean processed,
        String summary,
        ProcessingStatus processingStatus
) {
    /**
     * Newest first by {@code createdAt}, ties broken by {@code videoId} descending. Used wherever a cursor
     * or the oldest record has to be identified.
     */
    public static final Comparator<VideoRecord> NEWEST_FIRST = Comparator
            .comparing(VideoRecord::createdAtOrEpoch)
            .thenComparing(VideoRecord::videoId)
            .reversed();

    public VideoRecord {
        Objects.requireNonNull(videoId, "videoId cannot be null");
        Objects.requireNonNull(channelId, "channelId cannot be null");
        if (videoId.isBlank()) {
            throw new IllegalArgumentException("videoId cannot be blank");
        }
        if (channelId.isBlank()) {
            throw new IllegalArgumentException("channelId cannot be blank");
        }
        if (processingStatus == null) {
            processingStatus = ProcessingStatus.PENDING;
        }
    }

    /**
     * A record that has only been seen locally, e.g. the latest upload of a channel the user just added.
     */
    public static VideoRecord pending(String videoId, String channelId, String title, Instant publishedAt, Instant createdAt) {
        return new VideoRecord(videoId, channelId, title, publishedAt, createdAt, false, null, ProcessingStatus.PENDING);
    }

    @JsonIgnore
    public Instant createdAtOrEpoch() {
        return createdAt == null ? Instant.EPOCH : createdAt;
    }

    /**
     * processed implies a non-empty summary.
     */
    @JsonIgnore
    public boolean isConsistent() {
        return !processed || (summary != null && !summary.isBlank());
    }

    /**
     * True when this record carries a finished summary that {@code other} would regress.
     */
    public boolean isMoreCompleteThan(VideoRecord other) {
        return processed && !other.processed;
    }

    public VideoRecord withProcessed(boolean value) {
        return new VideoRecord(videoId, channelId, title, publishedAt, createdAt, value, summary, processingStatus);
    }
}
