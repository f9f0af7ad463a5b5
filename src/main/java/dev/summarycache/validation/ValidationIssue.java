package dev.summarycache.validation;

import java.util.Objects;

/**
 * @param kind        what is wrong
 * @param message     human-readable detail
 * @param affectedKey the store key the issue was found under
 */
public record ValidationIssue(IssueKind kind, String message, String affectedKey) {
    public ValidationIssue {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(affectedKey, "affectedKey cannot be null");
    }

    public Severity severity() {
        return kind.severity();
    }

    public boolean isCritical() {
        return kind.severity() == Severity.CRITICAL;
    }
}
