package dev.summarycache.api;

import dev.summarycache.model.VideoRecord;

import java.util.List;

/**
 * One page of video summaries, newest first.
 */
public record VideoPage(List<VideoRecord> videos, String nextCursor) {
    public VideoPage {
        videos = videos == null ? List.of() : List.copyOf(videos);
    }
}
