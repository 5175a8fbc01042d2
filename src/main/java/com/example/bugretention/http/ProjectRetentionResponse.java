package com.example.bugretention.http;

import com.example.bugretention.models.ProjectTier;
import com.example.bugretention.models.RetentionPolicy;
import com.example.bugretention.service.ComplianceTables.TierLimits;
import com.example.bugretention.service.ProjectRetentionView;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProjectRetentionResponse(
        @JsonProperty("projectId") String projectId,
        @JsonProperty("tier") ProjectTier tier,
        @JsonProperty("retention") RetentionPolicy retention,
        @JsonProperty("effectivePolicy") RetentionPolicy effectivePolicy,
        @JsonProperty("minimumRetentionDays") int minimumRetentionDays,
        @JsonProperty("tierLimits") TierLimits tierLimits,
        @JsonProperty("adminOverride") boolean adminOverride
) {
    static ProjectRetentionResponse from(ProjectRetentionView view) {
        return new ProjectRetentionResponse(
                view.projectId(),
                view.tier(),
                view.storedPolicy(),
                view.effectivePolicy(),
                view.minimumRetentionDays(),
                view.tierLimits(),
                view.adminOverride()
        );
    }
}
