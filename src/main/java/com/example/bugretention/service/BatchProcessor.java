package com.example.bugretention.service;

import com.example.bugretention.access.BugReportAccess;
import com.example.bugretention.models.BugReport;
import com.example.bugretention.models.DeletionReason;
import com.example.bugretention.models.Project;
import com.example.bugretention.models.RetentionPolicy;
import com.example.bugretention.storage.ArchiveResult;
import com.example.bugretention.storage.StorageArchiver;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Applies a resolved policy to one project: finds eligible reports, frees their files (archiving
 * them first when the policy asks for it), and soft-deletes them in bounded slices. Failures of individual
 * reports are captured as {@link RetentionError}s; only a missing collaborator fails the
 * whole project.
 */
@Service
@Slf4j
public class BatchProcessor {

    static final long MILLIS_PER_DAY = 86400000L;
    static final long SCREENSHOT_ESTIMATE_BYTES = 100L * 1024;
    static final long REPLAY_ESTIMATE_BYTES = 500L * 1024;

    private final BugReportAccess bugReportAccess;
    private final ObjectProvider<StorageArchiver> archiverProvider;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public BatchProcessor(BugReportAccess bugReportAccess,
                          ObjectProvider<StorageArchiver> archiverProvider,
                          AuditLogService auditLogService,
                          Clock clock) {
        this.bugReportAccess = bugReportAccess;
        this.archiverProvider = archiverProvider;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Lists what {@link #applyForProject} would soft-delete right now. Shared by preview and dry
     * runs so both report identical counts.
     */
    public ProjectPlan plan(Project project, RetentionPolicy policy) {
        long cutoff = clock.millis() - policy.getBugReportRetentionDays() * MILLIS_PER_DAY;
        List<BugReport> reports = bugReportAccess.findEligibleForDeletion(project.getId(), cutoff);

        long estimatedBytes = 0;
        Long oldest = null;
        for (BugReport report : reports) {
            if (report.hasScreenshot()) {
                estimatedBytes += SCREENSHOT_ESTIMATE_BYTES;
            }
            if (report.hasReplay()) {
                estimatedBytes += REPLAY_ESTIMATE_BYTES;
            }
            if (oldest == null || report.getCreatedAt() < oldest) {
                oldest = report.getCreatedAt();
            }
        }
        return new ProjectPlan(reports, cutoff, estimatedBytes, oldest == null ? null : Instant.ofEpochMilli(oldest));
    }

    public ProjectBatchResult applyForProject(Project project,
                                              RetentionPolicy policy,
                                              int batchSize,
                                              ErrorRateBreaker breaker,
                                              String runId) {
        ProjectPlan plan = plan(project, policy);
        if (plan.isEmpty()) {
            log.debug("[{}] No reports eligible for deletion in project {}", runId, project.getId());
            return ProjectBatchResult.empty();
        }

        boolean archive = policy.shouldArchiveBeforeDelete();
        StorageArchiver archiver = archiverProvider.getIfAvailable();
        if (archive && archiver == null) {
            throw new IllegalStateException("Policy requires archiving but no storage archiver is configured");
        }
        if (archiver == null) {
            log.warn("[{}] No storage archiver configured, files of project {} stay in storage",
                    runId, project.getId());
        }

        log.info("[{}] Applying {}-day retention to project {}: {} eligible reports (archive={})",
                runId, policy.getBugReportRetentionDays(), project.getId(), plan.reports().size(), archive);

        Tally tally = new Tally();
        List<BugReport> reports = plan.reports();
        for (int from = 0; from < reports.size(); from += batchSize) {
            if (breaker.isTripped()) {
                log.warn("[{}] Error rate {}% exceeded, skipping remaining slices of project {}",
                        runId, String.format("%.2f", breaker.errorRate()), project.getId());
                break;
            }
            List<BugReport> slice = reports.subList(from, Math.min(from + batchSize, reports.size()));
            int errorsBefore = tally.errors.size();
            processSlice(project, slice, archiver, archive, tally, runId);
            breaker.recordReports(slice.size(), tally.errors.size() - errorsBefore);
        }

        if (!tally.archivedIds.isEmpty()) {
            auditLogService.recordArchive(project.getId(), tally.archivedIds,
                    Map.of("strategy", archiver.strategyName(), "bytes_archived", tally.storageFreed));
        }
        if (!tally.deletedIds.isEmpty()) {
            auditLogService.recordSoftDelete(project.getId(), tally.deletedIds, DeletionReason.RETENTION_POLICY, null,
                    Map.of("retention_days", policy.getBugReportRetentionDays(),
                            "storage_freed", tally.storageFreed));
        }

        return new ProjectBatchResult(tally.deleted, tally.archivedIds.size(), tally.storageFreed,
                tally.screenshots, tally.replays, tally.errors);
    }

    /**
     * Frees the files of each report (archiving them first when {@code archive} is set), then
     * soft-deletes the reports whose files were handled. Without an archiver files are left in
     * place and nothing is counted as freed.
     */
    private void processSlice(Project project,
                              List<BugReport> slice,
                              StorageArchiver archiver,
                              boolean archive,
                              Tally tally,
                              String runId) {
        List<BugReport> deletable = new ArrayList<>();
        String action = archive ? "Archive" : "Storage delete";
        for (BugReport report : slice) {
            if (archiver == null) {
                deletable.add(report);
                continue;
            }
            try {
                ArchiveResult freed = archive
                        ? archiver.archiveReportFiles(report.getScreenshotUrl(), report.getReplayUrl())
                        : archiver.deleteReportFiles(report.getScreenshotUrl(), report.getReplayUrl());
                if (freed.hasErrors()) {
                    tally.errors.add(RetentionError.forReport(project.getId(), report.getId(),
                            action + " failed: " + describe(freed), clock.instant()));
                    continue;
                }
                if (archive) {
                    tally.archivedIds.add(report.getId());
                }
                tally.storageFreed += freed.bytesArchived();
                if (report.hasScreenshot()) {
                    tally.screenshots++;
                }
                if (report.hasReplay()) {
                    tally.replays++;
                }
                deletable.add(report);
            } catch (RuntimeException ex) {
                log.error("[{}] {} of report {} failed: {}", runId, action, report.getId(), ex.getMessage());
                tally.errors.add(RetentionError.forReport(project.getId(), report.getId(),
                        action + " failed: " + ex.getMessage(), clock.instant()));
            }
        }

        if (deletable.isEmpty()) {
            return;
        }

        List<String> ids = deletable.stream().map(BugReport::getId).collect(Collectors.toList());
        try {
            tally.deleted += bugReportAccess.softDelete(ids, null, clock.millis());
            tally.deletedIds.addAll(ids);
        } catch (RuntimeException ex) {
            log.error("[{}] Soft delete of {} reports in project {} failed: {}",
                    runId, ids.size(), project.getId(), ex.getMessage());
            Instant now = clock.instant();
            for (String id : ids) {
                tally.errors.add(RetentionError.forReport(project.getId(), id,
                        "Soft delete failed: " + ex.getMessage(), now));
            }
        }
    }

    private static String describe(ArchiveResult result) {
        return result.errors().stream()
                .map(e -> e.key() + ": " + e.error())
                .collect(Collectors.joining("; "));
    }

    private static final class Tally {
        private int deleted;
        private long storageFreed;
        private int screenshots;
        private int replays;
        private final List<String> archivedIds = new ArrayList<>();
        private final List<String> deletedIds = new ArrayList<>();
        private final List<RetentionError> errors = new ArrayList<>();
    }
}
