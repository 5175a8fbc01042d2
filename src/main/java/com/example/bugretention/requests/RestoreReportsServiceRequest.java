package com.example.bugretention.requests;

import java.util.List;

public record RestoreReportsServiceRequest(
        List<String> reportIds,
        String userId
) {

    public RestoreReportsServiceRequest {
        reportIds = ReportIds.normalize(reportIds);
    }
}
