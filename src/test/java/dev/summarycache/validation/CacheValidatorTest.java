package dev.summarycache.validation;

import dev.summarycache.config.CacheConfig;
import dev.summarycache.core.CacheRepository;
import dev.summarycache.model.CacheScope;
import dev.summarycache.model.ValidationStatus;
import dev.summarycache.store.CacheKeys;
import dev.summarycache.store.InMemoryKeyValueStore;
import dev.summarycache.store.Utils;
import dev.summarycache.testing.MutableClock;
import dev.summarycache.testing.Videos;
import dev.summarycache.tx.TransactionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CacheValidatorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    private InMemoryKeyValueStore store;
    private MutableClock clock;
    private CacheRepository repo;
    private CacheValidator validator;
    private final CacheScope scope = CacheScope.of("42");

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        clock = MutableClock.at(T0.plus(Duration.ofDays(1)));
        CacheConfig config = new CacheConfig();
        repo = new CacheRepository(store, new TransactionManager(store, clock), config, clock);
        validator = new CacheValidator(repo, config, clock);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void healthyCacheHasNoIssues() {
        repo.saveVideosToCache(scope, List.of(Videos.done("a", "A", T0), Videos.pending("b", "A", T0)));

        ValidationResult result = validator.validateCache(scope);

        assertTrue(result.isValid());
        assertTrue(result.issues().isEmpty());
        assertEquals(2, result.metrics().entriesChecked());
        assertEquals(ValidationStatus.HEALTHY, repo.getCacheStats(scope).validationStatus());
    }

    @Test
    void missingVideoIdIsExactlyOneCriticalIssue() {
        repo.saveVideosToCache(scope, List.of(Videos.done("a", "A", T0)));
        String key = CacheKeys.video(scope, "broken");
        put(key, "{\"channelId\":\"A\",\"processed\":true}");

        ValidationResult result = validator.validateCache(scope);

        assertFalse(result.isValid());
        List<ValidationIssue> critical = result.issues().stream().filter(ValidationIssue::isCritical).collect(Collectors.toList());
        assertEquals(1, critical.size());
        assertEquals(IssueKind.MISSING_REQUIRED_FIELD, critical.get(0).kind());
        assertEquals(key, critical.get(0).affectedKey());
        assertEquals(1, result.issues().size());
        assertEquals(ValidationStatus.CORRUPTED, repo.getCacheStats(scope).validationStatus());
    }

    @Test
    void unparsablePayloadIsCritical() {
        put(CacheKeys.video(scope, "x"), "not json at all");
        put(CacheKeys.channel(scope, "c"), "[1,2]");

        ValidationResult result = validator.validateCache(scope);

        assertEquals(2, result.issuesOf(IssueKind.UNREADABLE_RECORD).size());
        assertEquals(2, result.criticalKeys().size());
    }

    @Test
    void semanticProblemsAreWarnings() {
        put(CacheKeys.video(scope, "a"), "{\"videoId\":\"a\",\"channelId\":\"A\",\"processed\":true,\"summary\":\"\"}");
        put(CacheKeys.video(scope, "a-copy"), "{\"videoId\":\"a\",\"channelId\":\"A\",\"title\":\"t\"}");

        ValidationResult result = validator.validateCache(scope);

        assertTrue(result.isValid());
        assertEquals(1, result.issuesOf(IssueKind.MISSING_DISPLAY_FIELD).size());
        assertEquals(1, result.issuesOf(IssueKind.PROCESSED_WITHOUT_SUMMARY).size());
        assertEquals(1, result.issuesOf(IssueKind.DUPLICATE_VIDEO_ID).size());
        assertEquals(CacheKeys.video(scope, "a-copy"), result.issuesOf(IssueKind.DUPLICATE_VIDEO_ID).get(0).affectedKey());
        assertEquals(ValidationStatus.WARNING, result.status());
    }

    @Test
    void futureSyncTimestampIsInfo() {
        store.set(CacheKeys.lastSync(scope), Utils.encodeLong(clock.millis() + Duration.ofHours(1).toMillis()));

        ValidationResult result = validator.validateCache(scope);

        assertTrue(result.isValid());
        List<ValidationIssue> future = result.issuesOf(IssueKind.FUTURE_SYNC_TIMESTAMP);
        assertEquals(1, future.size());
        assertEquals(Severity.INFO, future.get(0).severity());
        assertEquals(ValidationStatus.HEALTHY, result.status());
    }

    @Test
    void smallClockSkewIsTolerated() {
        store.set(CacheKeys.lastSync(scope), Utils.encodeLong(clock.millis() + 1_000));
        assertTrue(validator.validateCache(scope).issues().isEmpty());
    }

    private void put(String key, String json) {
        store.set(key, json.getBytes(StandardCharsets.UTF_8));
    }
}
