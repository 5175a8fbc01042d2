package com.example.bugretention.requests;

import com.example.bugretention.models.ComplianceRegion;
import com.example.bugretention.models.DataClassification;
import com.example.bugretention.models.ProjectTier;
import com.example.bugretention.models.RetentionPolicy;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * HTTP-layer payload for PUT /api/v1/projects/{id}/retention. Absent fields keep their stored
 * values; tier and compliance rules are checked by the service.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateRetentionPolicyHttpRequest(
        @JsonProperty("bugReportRetentionDays") @Min(7) @Max(3650) Integer bugReportRetentionDays,
        @JsonProperty("screenshotRetentionDays") @Min(7) @Max(3650) Integer screenshotRetentionDays,
        @JsonProperty("replayRetentionDays") @Min(7) @Max(3650) Integer replayRetentionDays,
        @JsonProperty("attachmentRetentionDays") @Min(7) @Max(3650) Integer attachmentRetentionDays,
        @JsonProperty("archivedRetentionDays") @Min(30) @Max(7300) Integer archivedRetentionDays,
        @JsonProperty("archiveBeforeDelete") Boolean archiveBeforeDelete,
        @JsonProperty("dataClassification") DataClassification dataClassification,
        @JsonProperty("complianceRegion") ComplianceRegion complianceRegion,
        @JsonProperty("tier") ProjectTier tier
) {

    public RetentionPolicy toPolicy() {
        return RetentionPolicy.builder()
                .bugReportRetentionDays(bugReportRetentionDays)
                .screenshotRetentionDays(screenshotRetentionDays)
                .replayRetentionDays(replayRetentionDays)
                .attachmentRetentionDays(attachmentRetentionDays)
                .archivedRetentionDays(archivedRetentionDays)
                .archiveBeforeDelete(archiveBeforeDelete)
                .dataClassification(dataClassification)
                .complianceRegion(complianceRegion)
                .build();
    }
}
