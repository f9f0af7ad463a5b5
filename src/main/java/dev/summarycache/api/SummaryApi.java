package dev.summarycache.api;

import dev.summarycache.model.ChannelRecord;

import java.util.List;

/**
 * Remote source of truth. Implementations own transport, authentication and network timeouts; they may
 * report failure either by returning {@link ApiResponse#failure(String)} or by throwing.
 */
public interface SummaryApi {

    ApiResponse<VideoPage> fetchVideoSummaries(VideoPageRequest request);

    ApiResponse<List<ChannelRecord>> fetchUserChannels(String userId);
}
