package com.example.bugretention.service;

import java.util.List;

public record ProjectBatchResult(int deleted,
                                 int archived,
                                 long storageFreed,
                                 int screenshotsDeleted,
                                 int replaysDeleted,
                                 List<RetentionError> errors) {

    public ProjectBatchResult {
        errors = List.copyOf(errors);
    }

    public static ProjectBatchResult empty() {
        return new ProjectBatchResult(0, 0, 0L, 0, 0, List.of());
    }
}
