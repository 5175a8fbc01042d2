package com.example.bugretention.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.bugretention.config.RetentionProperties;
import com.example.bugretention.models.ComplianceRegion;
import com.example.bugretention.models.DataClassification;
import com.example.bugretention.models.Project;
import com.example.bugretention.models.ProjectTier;
import com.example.bugretention.models.RetentionPolicy;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PolicyResolverTest {

    private RetentionProperties properties;
    private ComplianceTables tables;
    private PolicyResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new RetentionProperties();
        tables = ComplianceTables.standard();
        resolver = new PolicyResolver(tables, properties, RetentionFixtures.MAPPER, RetentionFixtures.VALIDATOR);
    }

    private static Project project(String tier, Map<String, Object> retention) {
        Map<String, Object> settings = new LinkedHashMap<>();
        if (tier != null) {
            settings.put("tier", tier);
        }
        if (retention != null) {
            settings.put("retention", retention);
        }
        return Project.builder().id("p1").name("Demo").settings(settings).build();
    }

    @Test
    @DisplayName("resolved retention never drops below the compliance floor")
    void floorAlwaysHonoured() {
        for (ComplianceRegion region : ComplianceRegion.values()) {
            for (DataClassification classification : DataClassification.values()) {
                for (ProjectTier tier : ProjectTier.values()) {
                    for (boolean admin : new boolean[] {false, true}) {
                        Project project = project(tier.wireValue(), Map.of(
                                "bugReportRetentionDays", 1,
                                "dataClassification", classification.wireValue(),
                                "complianceRegion", region.wireValue()));

                        RetentionPolicy policy = resolver.resolve(project, admin);

                        int floor = tables.minRetentionDays(region, classification);
                        assertTrue(policy.getBugReportRetentionDays() >= floor,
                                region + "/" + classification + "/" + tier + " admin=" + admin);
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("KZ healthcare on the free tier resolves to the ten year floor")
    void floorBeatsTierMaximum() {
        Project project = project("free", Map.of(
                "bugReportRetentionDays", 30,
                "dataClassification", "healthcare",
                "complianceRegion", "kz"));

        RetentionPolicy policy = resolver.resolve(project, false);

        assertEquals(3650, policy.getBugReportRetentionDays());
        assertEquals(DataClassification.HEALTHCARE, policy.getDataClassification());
        assertEquals(ComplianceRegion.KZ, policy.getComplianceRegion());
    }

    @Test
    @DisplayName("tier bounds clamp non-admin resolution and are skipped for admins")
    void tierClamping() {
        Project project = project("free", Map.of("bugReportRetentionDays", 200));

        assertEquals(60, resolver.resolve(project, false).getBugReportRetentionDays());
        assertEquals(200, resolver.resolve(project, true).getBugReportRetentionDays());

        Project tooShort = project("professional", Map.of("bugReportRetentionDays", 10));
        assertEquals(30, resolver.resolve(tooShort, false).getBugReportRetentionDays());
    }

    @Test
    @DisplayName("stored admin override is honoured for non-admin resolution")
    void adminOverrideSkipsClamp() {
        Project project = project("free", Map.of("bugReportRetentionDays", 200));
        project.getSettings().put("adminOverride", true);

        assertEquals(200, resolver.resolve(project, false).getBugReportRetentionDays());
    }

    @Test
    @DisplayName("missing retention block falls back to the tier default")
    void missingPolicyUsesDefault() {
        RetentionPolicy policy = resolver.resolve(project("enterprise", null), false);

        assertEquals(90, policy.getBugReportRetentionDays());
        assertTrue(policy.shouldArchiveBeforeDelete());
        assertEquals(ComplianceRegion.NONE, policy.getComplianceRegion());
        assertEquals(DataClassification.GENERAL, policy.getDataClassification());
    }

    @Test
    @DisplayName("free tier default is capped at the tier maximum")
    void freeTierDefaultIsCapped() {
        RetentionPolicy policy = resolver.defaultPolicyFor(ProjectTier.FREE,
                DataClassification.GENERAL, ComplianceRegion.NONE);

        assertEquals(60, policy.getBugReportRetentionDays());
        assertTrue(policy.shouldArchiveBeforeDelete());
    }

    @Test
    @DisplayName("malformed stored policy falls back to the default without throwing")
    void malformedPolicyFallsBack() {
        Project negative = project("free", Map.of("bugReportRetentionDays", -5));
        Project wrongType = project("free", Map.of("bugReportRetentionDays", "forever"));
        Project missingDays = project("free", Map.of("archiveBeforeDelete", false));

        assertEquals(60, resolver.resolve(negative, false).getBugReportRetentionDays());
        assertEquals(60, resolver.resolve(wrongType, false).getBugReportRetentionDays());
        assertEquals(60, resolver.resolve(missingDays, false).getBugReportRetentionDays());
    }

    @Test
    @DisplayName("unknown tier in settings is treated as free")
    void unknownTierIsFree() {
        Project project = project("platinum", Map.of("bugReportRetentionDays", 200));

        assertEquals(60, resolver.resolve(project, false).getBugReportRetentionDays());
    }

    @Test
    @DisplayName("tiers that require archiving force archiveBeforeDelete")
    void archiveRequiredByTier() {
        Project pro = project("professional", Map.of("bugReportRetentionDays", 60, "archiveBeforeDelete", false));
        Project free = project("free", Map.of("bugReportRetentionDays", 30, "archiveBeforeDelete", false));

        assertTrue(resolver.resolve(pro, false).shouldArchiveBeforeDelete());
        assertFalse(resolver.resolve(free, false).shouldArchiveBeforeDelete());
    }

    @Test
    @DisplayName("region and classification default to the configured values")
    void configuredRegionDefault() {
        properties.setComplianceRegion(ComplianceRegion.KZ);

        RetentionPolicy policy = resolver.resolve(project("professional", Map.of("bugReportRetentionDays", 30)), false);

        assertEquals(ComplianceRegion.KZ, policy.getComplianceRegion());
        assertEquals(90, policy.getBugReportRetentionDays());
    }

    @Test
    @DisplayName("validation lists every violated bound")
    void validationListsAllProblems() {
        RetentionException ex = assertThrows(RetentionException.class, () -> resolver.validateRetentionDays(
                3, ProjectTier.FREE, DataClassification.GENERAL, ComplianceRegion.KZ, false));

        assertEquals(RetentionException.Code.VALIDATION_FAILED, ex.getCode());
        assertTrue(ex.getMessage().contains("compliance minimum of 90 days"));
        assertTrue(ex.getMessage().contains("tier minimum of 7 days"));
    }

    @Test
    @DisplayName("admins bypass tier bounds but not the compliance floor")
    void adminValidation() {
        resolver.validateRetentionDays(5000, ProjectTier.FREE, DataClassification.GENERAL, ComplianceRegion.NONE, true);

        RetentionException ex = assertThrows(RetentionException.class, () -> resolver.validateRetentionDays(
                100, ProjectTier.ENTERPRISE, DataClassification.FINANCIAL, ComplianceRegion.US, true));
        assertTrue(ex.getMessage().contains("2555"));
    }

    @Test
    @DisplayName("minimum retention is the larger of tier minimum and floor")
    void minimumRetention() {
        assertEquals(7, resolver.minimumRetentionDays(ProjectTier.FREE, DataClassification.GENERAL, ComplianceRegion.NONE));
        assertEquals(365, resolver.minimumRetentionDays(ProjectTier.PROFESSIONAL, DataClassification.FINANCIAL, ComplianceRegion.EU));
    }
}
