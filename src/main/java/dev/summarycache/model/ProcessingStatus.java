package dev.summarycache.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ProcessingStatus {
    @JsonProperty("pending") PENDING,
    @JsonProperty("processing") PROCESSING,
    @JsonProperty("done") DONE,
    @JsonProperty("failed") FAILED
}
