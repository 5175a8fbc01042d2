package com.example.bugretention.storage;

import java.util.List;

/**
 * Moves a report's stored files out of hot storage before the report is soft-deleted.
 * Implementations decide what "archive" means (delete, copy to an archive bucket, ...); failures
 * are reported per file in the result rather than thrown.
 */
public interface StorageArchiver {

    ArchiveResult archiveReportFiles(String screenshotUrl, String replayUrl);

    /**
     * Frees the report's files without archiving them, whatever the strategy.
     */
    ArchiveResult deleteReportFiles(String screenshotUrl, String replayUrl);

    default ArchiveResult archiveBatch(List<ReportFiles> reports) {
        ArchiveResult aggregate = ArchiveResult.empty();
        for (ReportFiles report : reports) {
            aggregate = aggregate.plus(archiveReportFiles(report.screenshotUrl(), report.replayUrl()));
        }
        return aggregate;
    }

    String strategyName();
}
