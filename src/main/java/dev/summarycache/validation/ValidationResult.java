package dev.summarycache.validation;

import dev.summarycache.model.ValidationStatus;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Outcome of one validation run. Valid iff no issue is critical.
 */
public record ValidationResult(List<ValidationIssue> issues, ValidationMetrics metrics) {

    public ValidationResult {
        issues = List.copyOf(issues);
    }

    public boolean isValid() {
        return issues.stream().noneMatch(ValidationIssue::isCritical);
    }

    public List<ValidationIssue> issuesOf(IssueKind kind) {
        return issues.stream().filter(i -> i.kind() == kind).collect(Collectors.toList());
    }

    /**
     * Distinct keys carrying at least one critical issue, in report order.
     */
    public Set<String> criticalKeys() {
        Set<String> keys = new LinkedHashSet<>();
        for (ValidationIssue i : issues) {
            if (i.isCritical()) keys.add(i.affectedKey());
        }
        return keys;
    }

    public ValidationStatus status() {
        if (!isValid()) {
            return ValidationStatus.CORRUPTED;
        }
        boolean warned = issues.stream().anyMatch(i -> i.severity() == Severity.WARNING);
        return warned ? ValidationStatus.WARNING : ValidationStatus.HEALTHY;
    }
}
