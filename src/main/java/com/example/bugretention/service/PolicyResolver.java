package com.example.bugretention.service;

import com.example.bugretention.config.RetentionProperties;
import com.example.bugretention.models.ComplianceRegion;
import com.example.bugretention.models.DataClassification;
import com.example.bugretention.models.Project;
import com.example.bugretention.models.ProjectRetentionSettings;
import com.example.bugretention.models.ProjectTier;
import com.example.bugretention.models.RetentionPolicy;
import com.example.bugretention.service.ComplianceTables.TierLimits;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Computes the retention policy that actually applies to a project. The compliance floor for
 * the project's region and classification is always honoured; tier bounds apply to everyone
 * except administrators.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PolicyResolver {

    private final ComplianceTables complianceTables;
    private final RetentionProperties properties;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    /**
     * Resolves the effective policy. Never throws on bad stored data: a malformed settings
     * document is logged and replaced by the tier default. Tier bounds are skipped for admins
     * and for settings an admin stored with {@code adminOverride}.
     */
    public RetentionPolicy resolve(Project project, boolean isAdmin) {
        ProjectRetentionSettings settings = readSettings(project);
        ProjectTier tier = settings.effectiveTier();
        RetentionPolicy stored = settings.getRetention();

        ComplianceRegion region = regionOf(stored);
        DataClassification classification = classificationOf(stored);
        RetentionPolicy fallback = defaultPolicyFor(tier, classification, region);

        if (stored == null) {
            log.debug("No retention policy stored for project {}, using {} tier default",
                    project.getId(), tier.wireValue());
            return fallback;
        }

        Set<ConstraintViolation<RetentionPolicy>> violations = validator.validate(stored);
        if (!violations.isEmpty()) {
            log.warn("Stored retention policy for project {} is invalid ({}), falling back to {} tier default",
                    project.getId(), describe(violations), tier.wireValue());
            return fallback;
        }

        RetentionPolicy merged = stored.withDefaults(fallback);
        int floor = floorFor(region, classification, project.getId());
        TierLimits limits = complianceTables.tierLimits(tier);

        int days = merged.getBugReportRetentionDays();
        if (!isAdmin && !settings.hasAdminOverride()) {
            days = clampToTier(days, limits);
        }
        days = Math.max(days, floor);

        boolean archive = merged.shouldArchiveBeforeDelete() || limits.archiveRequired();

        return merged.toBuilder()
                .bugReportRetentionDays(days)
                .archiveBeforeDelete(archive)
                .dataClassification(classification)
                .complianceRegion(region)
                .build();
    }

    /**
     * Configured default policy adjusted to the tier and the compliance floor.
     */
    public RetentionPolicy defaultPolicyFor(ProjectTier tier,
                                            DataClassification classification,
                                            ComplianceRegion region) {
        RetentionProperties.Defaults defaults = properties.getDefaults();
        TierLimits limits = complianceTables.tierLimits(tier);

        int days = defaults.getBugReportRetentionDays();
        if (!limits.isUnbounded()) {
            days = Math.min(days, limits.maxDays());
        }
        days = Math.max(days, minimumRetentionDays(tier, classification, region));

        return RetentionPolicy.builder()
                .bugReportRetentionDays(days)
                .screenshotRetentionDays(defaults.getScreenshotRetentionDays())
                .replayRetentionDays(defaults.getReplayRetentionDays())
                .attachmentRetentionDays(defaults.getAttachmentRetentionDays())
                .archivedRetentionDays(defaults.getArchivedRetentionDays())
                .archiveBeforeDelete(defaults.isArchiveBeforeDelete() || limits.archiveRequired())
                .dataClassification(classification)
                .complianceRegion(region)
                .build();
    }

    /**
     * Rejects a requested retention period that the caller may not configure.
     *
     * @throws RetentionException with {@code VALIDATION_FAILED} listing every violated bound
     */
    public void validateRetentionDays(int days,
                                      ProjectTier tier,
                                      DataClassification classification,
                                      ComplianceRegion region,
                                      boolean isAdmin) {
        List<String> problems = new ArrayList<>();
        TierLimits limits = complianceTables.tierLimits(tier);
        int floor = complianceTables.minRetentionDays(region, classification);

        if (days < floor) {
            problems.add("retention of " + days + " days is below the " + region.wireValue() + "/"
                    + classification.wireValue() + " compliance minimum of " + floor + " days");
        }
        if (!isAdmin && days < limits.minDays()) {
            problems.add("retention of " + days + " days is below the " + tier.wireValue()
                    + " tier minimum of " + limits.minDays() + " days");
        }
        if (!isAdmin && !limits.isUnbounded() && days > limits.maxDays()) {
            problems.add("retention of " + days + " days exceeds the " + tier.wireValue()
                    + " tier maximum of " + limits.maxDays() + " days");
        }
        if (!problems.isEmpty()) {
            throw RetentionException.validation(String.join("; ", problems));
        }
    }

    public int minimumRetentionDays(ProjectTier tier, DataClassification classification, ComplianceRegion region) {
        return Math.max(complianceTables.tierLimits(tier).minDays(),
                complianceTables.minRetentionDays(region, classification));
    }

    ProjectRetentionSettings readSettings(Project project) {
        Map<String, Object> raw = project.getSettings();
        if (raw == null || raw.isEmpty()) {
            return new ProjectRetentionSettings();
        }
        try {
            return objectMapper.convertValue(raw, ProjectRetentionSettings.class);
        } catch (IllegalArgumentException ex) {
            log.warn("Could not parse retention settings of project {}: {}", project.getId(), ex.getMessage());
            return ProjectRetentionSettings.builder()
                    .tier(tierOnly(raw))
                    .build();
        }
    }

    ComplianceRegion regionOf(RetentionPolicy stored) {
        return stored != null && stored.getComplianceRegion() != null
                ? stored.getComplianceRegion()
                : properties.getComplianceRegion();
    }

    DataClassification classificationOf(RetentionPolicy stored) {
        return stored != null && stored.getDataClassification() != null
                ? stored.getDataClassification()
                : properties.getDataClassification();
    }

    private int floorFor(ComplianceRegion region, DataClassification classification, String projectId) {
        if (!complianceTables.hasExplicitFloor(region, classification)) {
            log.warn("No compliance floor defined for {}/{} (project {}), assuming 0 days",
                    region.wireValue(), classification.wireValue(), projectId);
        }
        return complianceTables.minRetentionDays(region, classification);
    }

    private static int clampToTier(int days, TierLimits limits) {
        int clamped = Math.max(days, limits.minDays());
        if (!limits.isUnbounded()) {
            clamped = Math.min(clamped, limits.maxDays());
        }
        return clamped;
    }

    // Salvages the tier when the retention block is unreadable.
    private static ProjectTier tierOnly(Map<String, Object> raw) {
        Object tier = raw.get("tier");
        if (tier instanceof String s) {
            try {
                return ProjectTier.fromString(s);
            } catch (IllegalArgumentException ignored) {
                return ProjectTier.FREE;
            }
        }
        return ProjectTier.FREE;
    }

    private static String describe(Set<? extends ConstraintViolation<?>> violations) {
        return violations.stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
    }
}
