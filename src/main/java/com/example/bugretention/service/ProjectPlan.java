package com.example.bugretention.service;

import com.example.bugretention.models.BugReport;
import java.time.Instant;
import java.util.List;

/**
 * Reports of one project that the current policy would soft-delete, with a storage estimate.
 */
public record ProjectPlan(List<BugReport> reports, long cutoffMillis, long estimatedBytes, Instant oldestReportDate) {

    public ProjectPlan {
        reports = List.copyOf(reports);
    }

    public boolean isEmpty() {
        return reports.isEmpty();
    }
}
