package com.example.bugretention.service;

import com.example.bugretention.config.RetentionProperties.TierLimit;
import com.example.bugretention.models.ComplianceRegion;
import com.example.bugretention.models.DataClassification;
import com.example.bugretention.models.ProjectTier;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Read-only regulatory lookup data: minimum retention per region and classification, region
 * flags, and subscription tier limits. All maps are copied at construction and never mutated.
 */
public final class ComplianceTables {

    public static final String VERSION = "2024-11";

    public record TierLimits(int minDays, Integer maxDays, boolean archiveRequired) {

        public boolean isUnbounded() {
            return maxDays == null;
        }
    }

    private final Map<ComplianceRegion, Map<DataClassification, Integer>> floors;
    private final Set<ComplianceRegion> certificateRequired;
    private final Set<ComplianceRegion> trueDeletionRequired;
    private final Map<ProjectTier, TierLimits> tierLimits;

    private ComplianceTables(Map<ComplianceRegion, Map<DataClassification, Integer>> floors,
                             Set<ComplianceRegion> certificateRequired,
                             Set<ComplianceRegion> trueDeletionRequired,
                             Map<ProjectTier, TierLimits> tierLimits) {
        Map<ComplianceRegion, Map<DataClassification, Integer>> copy = new EnumMap<>(ComplianceRegion.class);
        floors.forEach((region, byClass) ->
                copy.put(region, Collections.unmodifiableMap(new EnumMap<>(byClass))));
        this.floors = Collections.unmodifiableMap(copy);
        this.certificateRequired = Collections.unmodifiableSet(EnumSet.copyOf(certificateRequired));
        this.trueDeletionRequired = Collections.unmodifiableSet(EnumSet.copyOf(trueDeletionRequired));
        this.tierLimits = Collections.unmodifiableMap(new EnumMap<>(tierLimits));
    }

    public static ComplianceTables standard() {
        return withTierLimits(Map.of(
                ProjectTier.FREE, new TierLimit(7, 60, false),
                ProjectTier.PROFESSIONAL, new TierLimit(30, 365, true),
                ProjectTier.ENTERPRISE, new TierLimit(30, null, true)));
    }

    /**
     * Standard regulatory tables combined with configured tier limits.
     *
     * @throws IllegalArgumentException when a tier is missing or its maximum is below its minimum
     */
    public static ComplianceTables withTierLimits(Map<ProjectTier, TierLimit> configured) {
        Map<ProjectTier, TierLimits> tiers = new EnumMap<>(ProjectTier.class);
        for (ProjectTier tier : ProjectTier.values()) {
            TierLimit limit = configured == null ? null : configured.get(tier);
            if (limit == null) {
                throw new IllegalArgumentException("Missing retention tier limits for " + tier.wireValue());
            }
            if (limit.getMaxDays() != null && limit.getMaxDays() < limit.getMinDays()) {
                throw new IllegalArgumentException("Tier " + tier.wireValue()
                        + " has maxDays below minDays");
            }
            tiers.put(tier, new TierLimits(limit.getMinDays(), limit.getMaxDays(), limit.isArchiveRequired()));
        }
        return new ComplianceTables(standardFloors(),
                EnumSet.of(ComplianceRegion.KZ, ComplianceRegion.EU, ComplianceRegion.US),
                EnumSet.of(ComplianceRegion.KZ, ComplianceRegion.EU),
                tiers);
    }

    public String version() {
        return VERSION;
    }

    /**
     * Regulatory minimum retention in days, 0 when the combination has no entry.
     */
    public int minRetentionDays(ComplianceRegion region, DataClassification classification) {
        Map<DataClassification, Integer> byClass = floors.get(region);
        if (byClass == null) {
            return 0;
        }
        return byClass.getOrDefault(classification, 0);
    }

    public boolean hasExplicitFloor(ComplianceRegion region, DataClassification classification) {
        Map<DataClassification, Integer> byClass = floors.get(region);
        return byClass != null && byClass.containsKey(classification);
    }

    public boolean certificateRequired(ComplianceRegion region) {
        return certificateRequired.contains(region);
    }

    public boolean trueDeletionRequired(ComplianceRegion region) {
        return trueDeletionRequired.contains(region);
    }

    public TierLimits tierLimits(ProjectTier tier) {
        return tierLimits.get(tier);
    }

    private static Map<ComplianceRegion, Map<DataClassification, Integer>> standardFloors() {
        Map<ComplianceRegion, Map<DataClassification, Integer>> floors = new EnumMap<>(ComplianceRegion.class);
        floors.put(ComplianceRegion.NONE, Map.of(
                DataClassification.GENERAL, 0,
                DataClassification.FINANCIAL, 0,
                DataClassification.GOVERNMENT, 0,
                DataClassification.HEALTHCARE, 0,
                DataClassification.PII, 0,
                DataClassification.SENSITIVE, 0));
        floors.put(ComplianceRegion.EU, Map.of(
                DataClassification.GENERAL, 0,
                DataClassification.FINANCIAL, 365,
                DataClassification.PII, 0));
        floors.put(ComplianceRegion.US, Map.of(
                DataClassification.GENERAL, 0,
                DataClassification.FINANCIAL, 2555,     // SOX, 7 years
                DataClassification.HEALTHCARE, 2555,    // HIPAA
                DataClassification.GOVERNMENT, 1095));
        floors.put(ComplianceRegion.KZ, Map.of(
                DataClassification.GENERAL, 90,
                DataClassification.FINANCIAL, 1825,
                DataClassification.GOVERNMENT, 1825,
                DataClassification.HEALTHCARE, 3650));
        floors.put(ComplianceRegion.UK, Map.of(
                DataClassification.GENERAL, 0,
                DataClassification.FINANCIAL, 2190,
                DataClassification.HEALTHCARE, 2920));
        floors.put(ComplianceRegion.CA, Map.of(
                DataClassification.GENERAL, 0,
                DataClassification.FINANCIAL, 2190,
                DataClassification.HEALTHCARE, 3650));
        return floors;
    }
}
