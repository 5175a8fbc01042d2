package com.example.bugretention.requests;

import java.util.UUID;

/**
 * Service-layer command for a retention run. {@code projectId} limits the run to one project;
 * null runs every project. Batch size is capped at {@link #MAX_BATCH_SIZE}.
 */
public record ApplyRetentionServiceRequest(
        String projectId,
        boolean dryRun,
        int batchSize,
        double maxErrorRate,
        long delayMs,
        boolean confirm,
        String runId
) {

    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final int MAX_BATCH_SIZE = 1000;
    public static final double DEFAULT_MAX_ERROR_RATE = 5.0;

    public ApplyRetentionServiceRequest {
        if (projectId != null && projectId.isBlank()) {
            projectId = null;
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        batchSize = Math.min(batchSize, MAX_BATCH_SIZE);
        if (maxErrorRate < 0 || maxErrorRate > 100) {
            throw new IllegalArgumentException("maxErrorRate must be between 0 and 100");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be non-negative");
        }
        runId = (runId == null || runId.isBlank()) ? "retention-run-" + UUID.randomUUID() : runId;
    }
}
