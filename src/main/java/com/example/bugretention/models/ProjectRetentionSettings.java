package com.example.bugretention.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Retention-related part of a project's settings document. Unknown keys are tolerated so other
 * settings can live in the same document.
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class ProjectRetentionSettings {

    private ProjectTier tier;

    @Valid
    private RetentionPolicy retention;

    // Derived from tier and compliance floor, cached when settings are written.
    @Min(0)
    private Integer minimumRetentionDays;

    // Set when an administrator stored a period outside the tier bounds.
    private Boolean adminOverride;

    public boolean hasAdminOverride() {
        return Boolean.TRUE.equals(adminOverride);
    }

    public ProjectTier effectiveTier() {
        return tier != null ? tier : ProjectTier.FREE;
    }
}
