package dev.summarycache.validation;

import dev.summarycache.api.CacheException;
import dev.summarycache.config.CacheConfig;
import dev.summarycache.core.CacheRepository;
import dev.summarycache.model.CacheScope;
import dev.summarycache.model.VideoRecord;
import dev.summarycache.store.CacheKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns validator findings into repair actions.
 *
 * <ul>
 *   <li>records with a critical issue are deleted, unless more than {@code criticalResetFraction} of all
 *       records are critical, in which case the scope is backed up, cleared and a full sync forced</li>
 *   <li>records that claim to be processed without a summary are downgraded to unprocessed</li>
 *   <li>duplicate copies of a video are deleted</li>
 * </ul>
 * The scope is validated again afterwards; the repair succeeds when no critical issue remains.
 */
public class CacheRecovery {
    private static final Logger logger = LoggerFactory.getLogger(CacheRecovery.class);
    private static final String MDC_SCOPE = "cacheScope";

    private final CacheRepository repository;
    private final CacheValidator validator;
    private final CacheConfig config;

    public CacheRecovery(CacheRepository repository, CacheValidator validator, CacheConfig config) {
        this.repository = Objects.requireNonNull(repository, "repository cannot be null");
        this.validator = Objects.requireNonNull(validator, "validator cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * @return true when the scope holds no critical issue after repair
     */
    public boolean validateAndRepair(CacheScope scope) {
        return repair(scope).success();
    }

    public RepairReport repair(CacheScope scope) {
        String outerScope = MDC.get(MDC_SCOPE);
        MDC.put(MDC_SCOPE, scope.userId());
        try {
            logger.info("Starting cache validation and repair");
            ValidationResult before = validator.validateCache(scope);
            if (before.issues().isEmpty()) {
                logger.info("Cache is healthy, nothing to repair");
                return new RepairReport(true, 0, 0, false);
            }

            Set<String> critical = before.criticalKeys();
            int checked = before.metrics().entriesChecked();
            if (checked > 0 && (double) critical.size() / checked > config.getCriticalResetFraction()) {
                logger.warn("{} of {} records are critically broken, resetting the scope", critical.size(), checked);
                repository.createBackup(scope);
                repository.clearCache(scope);
                repository.signalChannelListChanged(scope);
                ValidationResult after = validator.validateCache(scope);
                return new RepairReport(after.isValid(), checked, 0, true);
            }

            Set<String> doomed = new LinkedHashSet<>(critical);
            for (ValidationIssue issue : before.issuesOf(IssueKind.DUPLICATE_VIDEO_ID)) {
                doomed.add(issue.affectedKey());
            }

            List<VideoRecord> downgraded = new ArrayList<>();
            List<ValidationIssue> inconsistent = before.issuesOf(IssueKind.PROCESSED_WITHOUT_SUMMARY);
            if (!inconsistent.isEmpty()) {
                Map<String, VideoRecord> byKey = repository.getCachedVideos(scope).stream()
                        .collect(Collectors.toMap(v -> CacheKeys.video(scope, v.videoId()), Function.identity()));
                for (ValidationIssue issue : inconsistent) {
                    VideoRecord v = byKey.get(issue.affectedKey());
                    if (v != null && !doomed.contains(issue.affectedKey())) {
                        downgraded.add(v.withProcessed(false));
                    }
                }
            }

            repository.applyRepair(scope, doomed, downgraded);
            ValidationResult after = validator.validateCache(scope);
            RepairReport report = new RepairReport(after.isValid(), doomed.size(), downgraded.size(), false);
            logger.info("Repair finished: removed {}, downgraded {}, success {}",
                    report.removed(), report.downgraded(), report.success());
            return report;
        } catch (CacheException e) {
            logger.error("Repair failed: {}", e.getMessage(), e);
            return RepairReport.failed();
        } finally {
            restoreMdc(outerScope);
        }
    }

    /**
     * Puts the newest backup of {@code scope} back in place of its current records.
     *
     * @return true when a backup passed its checksum and was restored
     */
    public boolean restoreFromBackup(CacheScope scope) {
        String outerScope = MDC.get(MDC_SCOPE);
        MDC.put(MDC_SCOPE, scope.userId());
        try {
            return repository.restoreFromBackup(scope);
        } catch (CacheException e) {
            logger.error("Restore from backup failed: {}", e.getMessage(), e);
            return false;
        } finally {
            restoreMdc(outerScope);
        }
    }

    private static void restoreMdc(String outerScope) {
        if (outerScope == null) {
            MDC.remove(MDC_SCOPE);
        } else {
            MDC.put(MDC_SCOPE, outerScope);
        }
    }
}
