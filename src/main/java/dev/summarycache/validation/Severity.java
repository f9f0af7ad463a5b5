package dev.summarycache.validation;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}
