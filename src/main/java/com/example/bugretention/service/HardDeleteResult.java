package com.example.bugretention.service;

import com.example.bugretention.models.DeletionCertificate;
import java.util.List;

/**
 * @param projectId project owning the deleted reports, null when nothing was deleted
 * @param reportIds reports permanently removed; held and missing reports are not listed
 * @param certificate issued certificate, or null when none was required or requested
 */
public record HardDeleteResult(String projectId, List<String> reportIds, DeletionCertificate certificate) {

    public HardDeleteResult {
        reportIds = reportIds == null ? List.of() : List.copyOf(reportIds);
    }

    public static HardDeleteResult nothingDeleted() {
        return new HardDeleteResult(null, List.of(), null);
    }

    public int deletedCount() {
        return reportIds.size();
    }
}
