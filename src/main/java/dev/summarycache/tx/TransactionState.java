package dev.summarycache.tx;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TransactionState {
    @JsonProperty("pending") PENDING,
    @JsonProperty("committed") COMMITTED,
    @JsonProperty("rolledback") ROLLED_BACK
}
