package dev.summarycache.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChannelRecord(
        String channelId,
        String title,
        String thumbnail,
        Long subscriberCount,
        Long videoCount,
        Instant subscribedAt
) {
    public ChannelRecord {
        Objects.requireNonNull(channelId, "channelId cannot be null");
        if (channelId.isBlank()) {
            throw new IllegalArgumentException("channelId cannot be blank");
        }
    }
}
