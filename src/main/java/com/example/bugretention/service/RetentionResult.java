package com.example.bugretention.service;

import java.time.Instant;
import java.util.List;
import lombok.Builder;

/**
 * Aggregate outcome of one retention run. {@code aborted} is set when the error-rate breaker
 * stopped the run; the projects it never reached are listed in {@code projectsSkipped}.
 */
@Builder(toBuilder = true)
public record RetentionResult(int totalDeleted,
                              int totalArchived,
                              long storageFreed,
                              int screenshotsDeleted,
                              int replaysDeleted,
                              int projectsProcessed,
                              List<RetentionError> errors,
                              long durationMs,
                              Instant startedAt,
                              Instant completedAt,
                              boolean dryRun,
                              boolean aborted,
                              List<String> projectsSkipped) {

    public RetentionResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        projectsSkipped = projectsSkipped == null ? List.of() : List.copyOf(projectsSkipped);
    }
}
