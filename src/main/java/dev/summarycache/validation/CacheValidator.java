package dev.summarycache.validation;

import com.fasterxml.jackson.databind.JsonNode;
import dev.summarycache.config.CacheConfig;
import dev.summarycache.core.CacheRepository;
import dev.summarycache.model.CacheScope;
import dev.summarycache.model.ChannelRecord;
import dev.summarycache.model.VideoRecord;
import dev.summarycache.ser.JsonSerializer;
import dev.summarycache.store.CacheKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;

/**
 * Scans the stored records of a scope for structural and semantic corruption.
 *
 * <p>Checks run in this order for every record: payload decodes, required identity fields present,
 * display fields present, {@code processed} implies a summary, video id unique. A record that fails a
 * critical check is reported once and not checked further. The last-sync timestamp is checked against
 * the clock afterwards.
 *
 * <p>Each run stores its outcome through {@link CacheRepository#recordValidation}.
 */
public class CacheValidator {
    private static final Logger logger = LoggerFactory.getLogger(CacheValidator.class);

    private final CacheRepository repository;
    private final CacheConfig config;
    private final Clock clock;

    public CacheValidator(CacheRepository repository, CacheConfig config, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = (clock != null) ? clock : Clock.systemUTC();
    }

    /**
     * @throws dev.summarycache.api.StorageUnavailableException if the records cannot be read
     */
    public ValidationResult validateCache(CacheScope scope) {
        long start = clock.millis();
        SortedMap<String, byte[]> records = repository.readRawRecords(scope);
        List<ValidationIssue> issues = new ArrayList<>();
        Map<String, String> firstKeyByVideoId = new HashMap<>();

        for (Map.Entry<String, byte[]> e : records.entrySet()) {
            String key = e.getKey();
            if (key.startsWith(CacheKeys.VIDEOS)) {
                checkVideo(key, e.getValue(), issues, firstKeyByVideoId);
            } else {
                checkChannel(key, e.getValue(), issues);
            }
        }

        Instant lastSync = repository.getLastSyncTimestamp(scope);
        Instant tolerated = clock.instant().plusMillis(config.getFutureTimestampToleranceMs());
        if (lastSync.isAfter(tolerated)) {
            issues.add(new ValidationIssue(IssueKind.FUTURE_SYNC_TIMESTAMP,
                    "Last sync " + lastSync + " is ahead of the device clock", CacheKeys.lastSync(scope)));
        }

        ValidationResult result = new ValidationResult(issues,
                new ValidationMetrics(records.size(), clock.millis() - start));
        try {
            repository.recordValidation(scope, result.status());
        } catch (RuntimeException ex) {
            logger.warn("Could not store validation outcome for scope {}: {}", scope, ex.getMessage());
        }

        if (result.isValid()) {
            logger.debug("Validated {} records for scope {}: {} issues", records.size(), scope, issues.size());
        } else {
            logger.warn("Validation of scope {} found {} critical records among {} ({} issues total)",
                    scope, result.criticalKeys().size(), records.size(), issues.size());
        }
        return result;
    }

    private void checkVideo(String key, byte[] raw, List<ValidationIssue> issues, Map<String, String> firstKeyByVideoId) {
        JsonNode node = parse(key, raw, issues);
        if (node == null) return;

        String videoId = text(node, "videoId");
        if (videoId == null) {
            issues.add(new ValidationIssue(IssueKind.MISSING_REQUIRED_FIELD, "Video record has no videoId", key));
            return;
        }
        if (text(node, "channelId") == null) {
            issues.add(new ValidationIssue(IssueKind.MISSING_REQUIRED_FIELD, "Video " + videoId + " has no channelId", key));
            return;
        }

        VideoRecord video;
        try {
            video = JsonSerializer.treeToValue(node, VideoRecord.class);
        } catch (IOException | RuntimeException ex) {
            issues.add(new ValidationIssue(IssueKind.UNREADABLE_RECORD,
                    "Video " + videoId + " does not bind: " + ex.getMessage(), key));
            return;
        }

        if (text(node, "title") == null) {
            issues.add(new ValidationIssue(IssueKind.MISSING_DISPLAY_FIELD, "Video " + videoId + " has no title", key));
        }
        if (!video.isConsistent()) {
            issues.add(new ValidationIssue(IssueKind.PROCESSED_WITHOUT_SUMMARY,
                    "Video " + videoId + " is processed but has no summary", key));
        }
        String first = firstKeyByVideoId.putIfAbsent(videoId, key);
        if (first != null) {
            issues.add(new ValidationIssue(IssueKind.DUPLICATE_VIDEO_ID,
                    "Video " + videoId + " is also stored under " + first, key));
        }
    }

    private void checkChannel(String key, byte[] raw, List<ValidationIssue> issues) {
        JsonNode node = parse(key, raw, issues);
        if (node == null) return;

        String channelId = text(node, "channelId");
        if (channelId == null) {
            issues.add(new ValidationIssue(IssueKind.MISSING_REQUIRED_FIELD, "Channel record has no channelId", key));
            return;
        }
        try {
            JsonSerializer.treeToValue(node, ChannelRecord.class);
        } catch (IOException | RuntimeException ex) {
            issues.add(new ValidationIssue(IssueKind.UNREADABLE_RECORD,
                    "Channel " + channelId + " does not bind: " + ex.getMessage(), key));
            return;
        }
        if (text(node, "title") == null) {
            issues.add(new ValidationIssue(IssueKind.MISSING_DISPLAY_FIELD, "Channel " + channelId + " has no title", key));
        }
    }

    private static JsonNode parse(String key, byte[] raw, List<ValidationIssue> issues) {
        try {
            JsonNode node = JsonSerializer.readTree(raw);
            if (node.isObject()) {
                return node;
            }
            issues.add(new ValidationIssue(IssueKind.UNREADABLE_RECORD, "Payload is not a JSON object", key));
        } catch (IOException ex) {
            issues.add(new ValidationIssue(IssueKind.UNREADABLE_RECORD, "Payload is not valid JSON: " + ex.getMessage(), key));
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }
}
