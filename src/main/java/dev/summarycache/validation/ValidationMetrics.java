package dev.summarycache.validation;

public record ValidationMetrics(int entriesChecked, long durationMs) {
}
