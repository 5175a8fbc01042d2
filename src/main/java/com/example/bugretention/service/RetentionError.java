package com.example.bugretention.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.Instant;

/**
 * A failure captured during a retention run. {@code bugReportId} is null when the whole project
 * failed.
 */
@JsonInclude(Include.NON_NULL)
public record RetentionError(String projectId, String bugReportId, String error, Instant timestamp) {

    public static RetentionError forProject(String projectId, String error, Instant timestamp) {
        return new RetentionError(projectId, null, error, timestamp);
    }

    public static RetentionError forReport(String projectId, String bugReportId, String error, Instant timestamp) {
        return new RetentionError(projectId, bugReportId, error, timestamp);
    }
}
