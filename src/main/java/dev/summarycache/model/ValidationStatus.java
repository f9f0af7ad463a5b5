package dev.summarycache.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ValidationStatus {
    @JsonProperty("healthy") HEALTHY,
    @JsonProperty("warning") WARNING,
    @JsonProperty("corrupted") CORRUPTED
}
