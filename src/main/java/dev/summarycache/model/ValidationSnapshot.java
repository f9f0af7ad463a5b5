package dev.summarycache.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Objects;

/**
 * Stored outcome of the most recent validation run of a scope.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidationSnapshot(ValidationStatus status, Instant validatedAt) {
    public ValidationSnapshot {
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(validatedAt, "validatedAt cannot be null");
    }
}
