package com.example.bugretention.config;

import com.example.bugretention.models.ComplianceRegion;
import com.example.bugretention.models.DataClassification;
import com.example.bugretention.models.ProjectTier;
import java.util.EnumMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the retention engine.
 * These values are bound from application.yml (retention.*).
 * The defaults below serve as fallbacks if properties are missing from YAML.
 */
@Component
@ConfigurationProperties(prefix = "retention")
@Data
public class RetentionProperties {

    private Defaults defaults = new Defaults();
    private ComplianceRegion complianceRegion = ComplianceRegion.NONE;
    private DataClassification dataClassification = DataClassification.GENERAL;
    private Scheduler scheduler = new Scheduler();
    private Map<ProjectTier, TierLimit> tiers = defaultTiers();

    // Above this many affected reports a non dry-run apply must be confirmed explicitly.
    private int confirmationThreshold = 100;
    private Archive archive = new Archive();
    private Notifications notifications = new Notifications();

    @Data
    public static class Defaults {
        private int bugReportRetentionDays = 90;
        private int screenshotRetentionDays = 60;
        private int replayRetentionDays = 30;
        private int attachmentRetentionDays = 90;
        private int archivedRetentionDays = 365;
        private boolean archiveBeforeDelete = true;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private String cron = "0 0 2 * * *";  // 02:00 every day
        private String timezone = "UTC";
        private int batchSize = 100;
        private double maxErrorRate = 5.0;
        private long delayMs = 100;
    }

    @Data
    public static class TierLimit {
        private int minDays;
        private Integer maxDays;   // null means unbounded
        private boolean archiveRequired;

        public TierLimit() {
        }

        public TierLimit(int minDays, Integer maxDays, boolean archiveRequired) {
            this.minDays = minDays;
            this.maxDays = maxDays;
            this.archiveRequired = archiveRequired;
        }
    }

    @Data
    public static class Archive {
        private String strategy = "deletion";  // deletion | copy
    }

    @Data
    public static class Notifications {
        private String type = "logging";  // logging | webhook
        private String webhookUrl;
        private String channel;
    }

    private static Map<ProjectTier, TierLimit> defaultTiers() {
        Map<ProjectTier, TierLimit> tiers = new EnumMap<>(ProjectTier.class);
        tiers.put(ProjectTier.FREE, new TierLimit(7, 60, false));
        tiers.put(ProjectTier.PROFESSIONAL, new TierLimit(30, 365, true));
        tiers.put(ProjectTier.ENTERPRISE, new TierLimit(30, null, true));
        return tiers;
    }
}
