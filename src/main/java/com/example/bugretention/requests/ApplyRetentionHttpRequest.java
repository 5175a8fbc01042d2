package com.example.bugretention.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * HTTP-layer payload for POST /api/v1/admin/retention/apply. Every field is optional.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApplyRetentionHttpRequest(
        @JsonProperty("projectId") String projectId,
        @JsonProperty("dryRun") Boolean dryRun,
        @JsonProperty("batchSize") @Min(1) @Max(ApplyRetentionServiceRequest.MAX_BATCH_SIZE) Integer batchSize,
        @JsonProperty("maxErrorRate") @DecimalMin("0") @DecimalMax("100") Double maxErrorRate,
        @JsonProperty("confirm") Boolean confirm
) {

    public ApplyRetentionServiceRequest toServiceRequest(String runId) {
        return new ApplyRetentionServiceRequest(
                projectId,
                Boolean.TRUE.equals(dryRun),
                batchSize != null ? batchSize : ApplyRetentionServiceRequest.DEFAULT_BATCH_SIZE,
                maxErrorRate != null ? maxErrorRate : ApplyRetentionServiceRequest.DEFAULT_MAX_ERROR_RATE,
                0,
                Boolean.TRUE.equals(confirm),
                runId);
    }
}
