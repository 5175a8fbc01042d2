package com.example.bugretention.service;

import java.time.Instant;
import java.util.List;

public record RetentionPreview(List<ProjectPreview> affectedProjects,
                               long totalReports,
                               long totalStorageBytes,
                               long legalHoldCount) {

    public record ProjectPreview(String projectId,
                                 String projectName,
                                 int reportsToDelete,
                                 long estimatedStorageFreed,
                                 Instant oldestReportDate) { }
}
