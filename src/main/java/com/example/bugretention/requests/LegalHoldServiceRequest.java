package com.example.bugretention.requests;

import java.util.List;

public record LegalHoldServiceRequest(
        List<String> reportIds,
        boolean hold,
        String userId
) {

    public LegalHoldServiceRequest {
        reportIds = ReportIds.normalize(reportIds);
    }
}
