package com.example.bugretention.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Retention configuration for a project, stored under {@code settings.retention}. Every field
 * except {@code bugReportRetentionDays} may be absent in a stored document; the resolver fills
 * gaps from the tier default.
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor                     // required by Jackson
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class RetentionPolicy {

    @NotNull
    @Min(0)
    private Integer bugReportRetentionDays;

    @Min(0)
    private Integer screenshotRetentionDays;

    @Min(0)
    private Integer replayRetentionDays;

    @Min(0)
    private Integer attachmentRetentionDays;

    @Min(0)
    private Integer archivedRetentionDays;

    private Boolean archiveBeforeDelete;

    private DataClassification dataClassification;

    private ComplianceRegion complianceRegion;

    public boolean shouldArchiveBeforeDelete() {
        return Boolean.TRUE.equals(archiveBeforeDelete);
    }

    /**
     * Returns a copy where every absent field is taken from {@code defaults}.
     */
    public RetentionPolicy withDefaults(RetentionPolicy defaults) {
        return toBuilder()
                .bugReportRetentionDays(orElse(bugReportRetentionDays, defaults.bugReportRetentionDays))
                .screenshotRetentionDays(orElse(screenshotRetentionDays, defaults.screenshotRetentionDays))
                .replayRetentionDays(orElse(replayRetentionDays, defaults.replayRetentionDays))
                .attachmentRetentionDays(orElse(attachmentRetentionDays, defaults.attachmentRetentionDays))
                .archivedRetentionDays(orElse(archivedRetentionDays, defaults.archivedRetentionDays))
                .archiveBeforeDelete(orElse(archiveBeforeDelete, defaults.archiveBeforeDelete))
                .dataClassification(orElse(dataClassification, defaults.dataClassification))
                .complianceRegion(orElse(complianceRegion, defaults.complianceRegion))
                .build();
    }

    private static <T> T orElse(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
