package com.example.bugretention.http;

import com.example.bugretention.models.ComplianceRegion;
import com.example.bugretention.models.RetentionPolicy;
import com.example.bugretention.service.ComplianceTables.TierLimits;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.ZonedDateTime;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RetentionStatusResponse(
        @JsonProperty("defaultPolicy") RetentionPolicy defaultPolicy,
        @JsonProperty("complianceRegion") ComplianceRegion complianceRegion,
        @JsonProperty("tierLimits") Map<String, TierLimits> tierLimits,
        @JsonProperty("confirmationThreshold") int confirmationThreshold,
        @JsonProperty("complianceTablesVersion") String complianceTablesVersion,
        @JsonProperty("scheduler") Scheduler scheduler
) {
    public record Scheduler(
            @JsonProperty("enabled") boolean enabled,
            @JsonProperty("cron") String cron,
            @JsonProperty("timezone") String timezone,
            @JsonProperty("running") boolean running,
            @JsonProperty("nextRunTime") ZonedDateTime nextRunTime
    ) {}
}
