package com.example.bugretention.http;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a legal hold or restore request: how many of the requested reports changed.
 */
public record ReportMutationResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("requested") int requested,
        @JsonProperty("affected") int affected
) {
    public ReportMutationResponse {
        if (affected < 0 || affected > requested) {
            throw new IllegalArgumentException("affected must be between 0 and requested");
        }
    }
}
