package com.example.bugretention.requests;

import com.example.bugretention.models.DeletionReason;
import java.util.List;

/**
 * Service-layer command for permanent deletion. The HTTP confirmation flag is checked before
 * this command is built; the service only ever sees confirmed requests.
 */
public record HardDeleteServiceRequest(
        List<String> reportIds,
        String userId,
        DeletionReason reason,
        boolean generateCertificate
) {

    public HardDeleteServiceRequest {
        reportIds = ReportIds.normalize(reportIds);
        reason = reason == null ? DeletionReason.MANUAL : reason;
    }
}
