package com.example.bugretention.service;

import com.example.bugretention.access.BugReportAccess;
import com.example.bugretention.access.DeletionCertificateAccess;
import com.example.bugretention.access.ProjectAccess;
import com.example.bugretention.access.WriteContext;
import com.example.bugretention.access.WriteTransactions;
import com.example.bugretention.config.RetentionProperties;
import com.example.bugretention.models.BugReport;
import com.example.bugretention.models.DeletionCertificate;
import com.example.bugretention.models.Project;
import com.example.bugretention.models.ProjectRetentionSettings;
import com.example.bugretention.models.ProjectTier;
import com.example.bugretention.models.RetentionPolicy;
import com.example.bugretention.requests.ApplyRetentionServiceRequest;
import com.example.bugretention.requests.HardDeleteServiceRequest;
import com.example.bugretention.requests.LegalHoldServiceRequest;
import com.example.bugretention.requests.RestoreReportsServiceRequest;
import com.example.bugretention.requests.UpdateRetentionServiceRequest;
import com.example.bugretention.service.ComplianceTables.TierLimits;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;

/**
 * Entry point for every retention operation: preview, scheduled and manual runs, legal holds,
 * restore, permanent deletion and per-project settings.
 */
@Service
@Slf4j
public class RetentionService {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private final ProjectAccess projectAccess;
    private final BugReportAccess bugReportAccess;
    private final DeletionCertificateAccess certificateAccess;
    private final WriteTransactions writeTransactions;
    private final PolicyResolver policyResolver;
    private final BatchProcessor batchProcessor;
    private final CertificateGenerator certificateGenerator;
    private final ComplianceTables complianceTables;
    private final AuditLogService auditLogService;
    private final RetentionProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RetentionService(ProjectAccess projectAccess,
                            BugReportAccess bugReportAccess,
                            DeletionCertificateAccess certificateAccess,
                            WriteTransactions writeTransactions,
                            PolicyResolver policyResolver,
                            BatchProcessor batchProcessor,
                            CertificateGenerator certificateGenerator,
                            ComplianceTables complianceTables,
                            AuditLogService auditLogService,
                            RetentionProperties properties,
                            ObjectMapper objectMapper,
                            Clock clock) {
        this.projectAccess = projectAccess;
        this.bugReportAccess = bugReportAccess;
        this.certificateAccess = certificateAccess;
        this.writeTransactions = writeTransactions;
        this.policyResolver = policyResolver;
        this.batchProcessor = batchProcessor;
        this.certificateGenerator = certificateGenerator;
        this.complianceTables = complianceTables;
        this.auditLogService = auditLogService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Read-only view of what a run would soft-delete now.
     *
     * @param projectId restricts the preview to one project, null for all
     */
    public RetentionPreview previewRetentionPolicy(String projectId) {
        List<RetentionPreview.ProjectPreview> affected = new ArrayList<>();
        long totalReports = 0;
        long totalBytes = 0;

        for (Project project : selectProjects(projectId)) {
            RetentionPolicy policy = policyResolver.resolve(project, false);
            ProjectPlan plan = batchProcessor.plan(project, policy);
            if (plan.isEmpty()) {
                continue;
            }
            affected.add(new RetentionPreview.ProjectPreview(project.getId(), project.getName(),
                    plan.reports().size(), plan.estimatedBytes(), plan.oldestReportDate()));
            totalReports += plan.reports().size();
            totalBytes += plan.estimatedBytes();
        }

        return new RetentionPreview(affected, totalReports, totalBytes, bugReportAccess.countLegalHoldReports());
    }

    /**
     * Applies every project's effective policy, one project at a time.
     *
     * @throws RetentionException {@code CONFIRMATION_REQUIRED} when a real run would affect more
     *         reports than the configured threshold and {@code confirm} is not set; nothing is
     *         modified in that case
     */
    public RetentionResult applyRetentionPolicies(ApplyRetentionServiceRequest request) {
        Objects.requireNonNull(request, "request");
        String runId = request.runId();
        Instant startedAt = clock.instant();

        if (!request.dryRun() && !request.confirm()) {
            RetentionPreview preview = previewRetentionPolicy(request.projectId());
            if (preview.totalReports() > properties.getConfirmationThreshold()) {
                log.warn("[{}] Refusing unconfirmed run affecting {} reports (threshold {})",
                        runId, preview.totalReports(), properties.getConfirmationThreshold());
                throw RetentionException.confirmationRequired(preview.totalReports(),
                        properties.getConfirmationThreshold());
            }
        }

        List<Project> projects = selectProjects(request.projectId());
        log.info("[{}] Starting retention run over {} projects (dryRun={}, batchSize={}, maxErrorRate={})",
                runId, projects.size(), request.dryRun(), request.batchSize(), request.maxErrorRate());

        ErrorRateBreaker breaker = new ErrorRateBreaker(request.maxErrorRate());
        RunTotals totals = new RunTotals();
        List<String> skipped = new ArrayList<>();
        boolean aborted = false;

        for (int i = 0; i < projects.size(); i++) {
            Project project = projects.get(i);
            if (breaker.isTripped()) {
                log.error("[{}] Error rate {}% exceeds {}%, aborting run", runId,
                        String.format("%.2f", breaker.errorRate()), request.maxErrorRate());
                aborted = true;
                projects.subList(i, projects.size()).forEach(p -> skipped.add(p.getId()));
                break;
            }

            try {
                RetentionPolicy policy = policyResolver.resolve(project, false);
                if (request.dryRun()) {
                    totals.addPlan(batchProcessor.plan(project, policy), policy);
                } else {
                    totals.add(batchProcessor.applyForProject(project, policy, request.batchSize(), breaker, runId));
                }
                totals.projectsProcessed++;
            } catch (RuntimeException ex) {
                log.error("[{}] Retention failed for project {}: {}", runId, project.getId(), ex.getMessage(), ex);
                totals.errors.add(RetentionError.forProject(project.getId(), ex.getMessage(), clock.instant()));
                breaker.recordProjectFailure();
            }

            if (request.delayMs() > 0 && i < projects.size() - 1 && !pause(request.delayMs())) {
                log.warn("[{}] Interrupted between projects, stopping run", runId);
                aborted = true;
                projects.subList(i + 1, projects.size()).forEach(p -> skipped.add(p.getId()));
                break;
            }
        }
        aborted = aborted || breaker.isTripped();

        Instant completedAt = clock.instant();
        RetentionResult result = RetentionResult.builder()
                .totalDeleted(totals.deleted)
                .totalArchived(totals.archived)
                .storageFreed(totals.storageFreed)
                .screenshotsDeleted(totals.screenshots)
                .replaysDeleted(totals.replays)
                .projectsProcessed(totals.projectsProcessed)
                .errors(totals.errors)
                .durationMs(Duration.between(startedAt, completedAt).toMillis())
                .startedAt(startedAt)
                .completedAt(completedAt)
                .dryRun(request.dryRun())
                .aborted(aborted)
                .projectsSkipped(skipped)
                .build();

        log.info("[{}] Completed retention run in {}ms: projects={}, deleted={}, archived={}, freed={} bytes, errors={}, aborted={}",
                runId, result.durationMs(), result.projectsProcessed(), result.totalDeleted(),
                result.totalArchived(), result.storageFreed(), result.errors().size(), result.aborted());
        return result;
    }

    /**
     * Sets or clears the legal hold flag. Only rows whose flag actually changed are audited.
     *
     * @return number of reports whose flag actually changed
     */
    public int setLegalHold(LegalHoldServiceRequest request) {
        Objects.requireNonNull(request, "request");
        List<BugReport> changed = bugReportAccess.setLegalHold(request.reportIds(), request.hold());

        byProject(changed).forEach((projectId, ids) ->
                auditLogService.recordLegalHold(projectId, ids, request.hold(), request.userId()));

        log.info("Legal hold {} on {} of {} requested reports by {}",
                request.hold() ? "applied" : "released", changed.size(), request.reportIds().size(), request.userId());
        return changed.size();
    }

    /**
     * Clears the deletion marker of soft-deleted reports.
     *
     * @return number of reports restored
     */
    public int restoreReports(RestoreReportsServiceRequest request) {
        Objects.requireNonNull(request, "request");
        List<BugReport> restored = bugReportAccess.restore(request.reportIds());

        byProject(restored).forEach((projectId, ids) ->
                auditLogService.recordRestore(projectId, ids, request.userId()));

        log.info("Restored {} of {} requested reports by {}", restored.size(), request.reportIds().size(), request.userId());
        return restored.size();
    }

    /**
     * Permanently deletes the non-held reports and records the outcome in the audit log once
     * committed. Requests that do not fit one write transaction together with their certificate
     * are split; the certificate, covering every report, is committed with the last part.
     *
     * @throws RetentionException {@code TRANSACTION_ABORTED} when a report changed concurrently.
     *         Parts committed before that stay deleted and are certified and audited on their own
     */
    public HardDeleteResult hardDeleteReports(HardDeleteServiceRequest request) {
        Objects.requireNonNull(request, "request");
        HardDeletePlan plan = planHardDelete(request);
        if (plan.ids().isEmpty()) {
            return HardDeleteResult.nothingDeleted();
        }

        List<List<String>> parts = transactionParts(plan.ids(), plan.certificateNeeded());
        List<String> deleted = new ArrayList<>();
        DeletionCertificate certificate = null;
        try {
            for (int i = 0; i < parts.size(); i++) {
                List<String> part = parts.get(i);
                boolean last = i == parts.size() - 1;
                certificate = writeTransactions.execute(tx -> {
                    bugReportAccess.hardDelete(tx, part);
                    return last ? stageCertificate(tx, plan, plan.ids(), request) : null;
                });
                deleted.addAll(part);
            }
        } catch (TransactionCanceledException ex) {
            log.warn("Hard delete in project {} cancelled after {} of {} reports: {}",
                    plan.projectId(), deleted.size(), plan.ids().size(), ex.getMessage());
            RetentionException aborted = RetentionException.transactionAborted(deleted.isEmpty()
                    ? "a report changed (e.g. legal hold applied) while deleting, nothing was deleted"
                    : "a report changed while deleting, " + deleted.size() + " of " + plan.ids().size()
                            + " reports were already deleted", ex);
            if (!deleted.isEmpty()) {
                try {
                    recordCommittedPart(plan, deleted, request);
                } catch (RuntimeException followUp) {
                    aborted.addSuppressed(followUp);
                }
            }
            throw aborted;
        }

        auditLogService.recordHardDelete(plan.projectId(), deleted, request.userId(),
                certificate == null ? null : certificate.getCertificateId());
        return new HardDeleteResult(plan.projectId(), deleted, certificate);
    }

    /**
     * Stages permanent deletion of the non-held reports in {@code tx}, plus a deletion
     * certificate when the project's region requires one or the caller asked for it. Nothing is
     * read or written unless {@code tx} is transactional. Everything must fit in {@code tx}.
     */
    public HardDeleteResult hardDeleteReports(WriteContext tx, HardDeleteServiceRequest request) {
        if (tx == null || !tx.isTransactional()) {
            throw RetentionException.transactionRequired("Hard delete");
        }
        Objects.requireNonNull(request, "request");

        HardDeletePlan plan = planHardDelete(request);
        if (plan.ids().isEmpty()) {
            return HardDeleteResult.nothingDeleted();
        }
        DeletionCertificate certificate;
        try {
            bugReportAccess.hardDelete(tx, plan.ids());
            certificate = stageCertificate(tx, plan, plan.ids(), request);
        } catch (IllegalArgumentException ex) {
            throw RetentionException.validation(ex.getMessage());
        }
        return new HardDeleteResult(plan.projectId(), plan.ids(), certificate);
    }

    /**
     * Splits {@code ids} so that every part fits one transaction and the last part leaves room
     * for the certificate.
     */
    static List<List<String>> transactionParts(List<String> ids, boolean withCertificate) {
        int lastCapacity = WriteTransactions.MAX_ACTIONS - (withCertificate ? 1 : 0);
        int tailStart = Math.max(0, ids.size() - lastCapacity);
        List<List<String>> parts = new ArrayList<>();
        for (int from = 0; from < tailStart; from += WriteTransactions.MAX_ACTIONS) {
            parts.add(ids.subList(from, Math.min(from + WriteTransactions.MAX_ACTIONS, tailStart)));
        }
        parts.add(ids.subList(tailStart, ids.size()));
        return parts;
    }

    private HardDeletePlan planHardDelete(HardDeleteServiceRequest request) {
        List<BugReport> eligible = bugReportAccess.findByIds(request.reportIds()).stream()
                .filter(r -> !r.isOnLegalHold())
                .collect(Collectors.toList());
        if (eligible.isEmpty()) {
            log.info("Hard delete requested for {} reports, none eligible", request.reportIds().size());
            return new HardDeletePlan(null, List.of(), null, false);
        }

        Set<String> projectIds = eligible.stream().map(BugReport::getProjectId).collect(Collectors.toSet());
        if (projectIds.size() > 1) {
            throw RetentionException.validation("Hard delete reports must belong to a single project, got "
                    + projectIds.size());
        }
        String projectId = projectIds.iterator().next();
        Project project = projectAccess.findById(projectId)
                .orElseThrow(() -> RetentionException.projectNotFound(projectId));
        RetentionPolicy policy = policyResolver.resolve(project, true);

        List<String> ids = eligible.stream().map(BugReport::getId).collect(Collectors.toList());
        boolean certificateNeeded = complianceTables.certificateRequired(policy.getComplianceRegion())
                || request.generateCertificate();
        log.info("Hard delete of {} reports in project {} (certificate={})", ids.size(), projectId, certificateNeeded);
        return new HardDeletePlan(projectId, ids, policy, certificateNeeded);
    }

    private DeletionCertificate stageCertificate(WriteContext tx,
                                                 HardDeletePlan plan,
                                                 List<String> ids,
                                                 HardDeleteServiceRequest request) {
        if (!plan.certificateNeeded()) {
            return null;
        }
        DeletionCertificate certificate = certificateGenerator.issue(plan.projectId(), ids, request.userId(),
                request.reason(), plan.policy().getDataClassification(), plan.policy().getComplianceRegion());
        certificateAccess.save(tx, certificate);
        return certificate;
    }

    private void recordCommittedPart(HardDeletePlan plan, List<String> deleted, HardDeleteServiceRequest request) {
        DeletionCertificate certificate = writeTransactions.execute(tx -> stageCertificate(tx, plan, deleted, request));
        auditLogService.recordHardDelete(plan.projectId(), deleted, request.userId(),
                certificate == null ? null : certificate.getCertificateId());
    }

    private record HardDeletePlan(String projectId, List<String> ids, RetentionPolicy policy,
                                  boolean certificateNeeded) { }

    public ProjectRetentionView getProjectRetention(String projectId) {
        Project project = projectAccess.findById(projectId)
                .orElseThrow(() -> RetentionException.projectNotFound(projectId));
        return viewOf(project);
    }

    /**
     * Validates and stores a partial policy update. Unrelated keys of the settings document are
     * preserved; {@code minimumRetentionDays} is recomputed.
     */
    public ProjectRetentionView updateProjectRetention(UpdateRetentionServiceRequest request) {
        Objects.requireNonNull(request, "request");
        Project project = projectAccess.findById(request.projectId())
                .orElseThrow(() -> RetentionException.projectNotFound(request.projectId()));

        ProjectRetentionSettings current = policyResolver.readSettings(project);
        ProjectTier tier = request.tier() != null ? request.tier() : current.effectiveTier();
        if (!request.isAdmin() && tier != current.effectiveTier()) {
            throw RetentionException.validation("Only administrators may change a project's tier");
        }

        RetentionPolicy stored = current.getRetention();
        RetentionPolicy tierDefault = policyResolver.defaultPolicyFor(tier,
                policyResolver.classificationOf(request.policy().getDataClassification() != null
                        ? request.policy() : stored),
                policyResolver.regionOf(request.policy().getComplianceRegion() != null
                        ? request.policy() : stored));
        RetentionPolicy base = stored == null || stored.getBugReportRetentionDays() == null
                ? tierDefault
                : stored.withDefaults(tierDefault);
        RetentionPolicy merged = request.policy().withDefaults(base);

        int days = merged.getBugReportRetentionDays();
        policyResolver.validateRetentionDays(days, tier, merged.getDataClassification(),
                merged.getComplianceRegion(), request.isAdmin());

        TierLimits limits = complianceTables.tierLimits(tier);
        if (limits.archiveRequired() && !merged.shouldArchiveBeforeDelete()) {
            merged = merged.toBuilder().archiveBeforeDelete(true).build();
        }
        boolean outsideTier = days < limits.minDays() || (!limits.isUnbounded() && days > limits.maxDays());
        int minimum = policyResolver.minimumRetentionDays(tier, merged.getDataClassification(),
                merged.getComplianceRegion());

        Map<String, Object> settings = new LinkedHashMap<>();
        if (project.getSettings() != null) {
            settings.putAll(project.getSettings());
        }
        settings.put("tier", tier.wireValue());
        settings.put("retention", objectMapper.convertValue(merged, MAP_TYPE));
        settings.put("minimumRetentionDays", minimum);
        if (outsideTier) {
            settings.put("adminOverride", true);
        } else {
            settings.remove("adminOverride");
        }

        Project saved = projectAccess.save(project.toBuilder().settings(settings).build());
        log.info("Updated retention of project {} by {}: tier={}, days={}, minimum={}, adminOverride={}",
                saved.getId(), request.userId(), tier.wireValue(), days, minimum, outsideTier);
        return viewOf(saved);
    }

    private ProjectRetentionView viewOf(Project project) {
        ProjectRetentionSettings settings = policyResolver.readSettings(project);
        ProjectTier tier = settings.effectiveTier();
        RetentionPolicy effective = policyResolver.resolve(project, false);
        int minimum = policyResolver.minimumRetentionDays(tier, effective.getDataClassification(),
                effective.getComplianceRegion());
        return new ProjectRetentionView(project.getId(), tier, settings.getRetention(), effective, minimum,
                complianceTables.tierLimits(tier), settings.hasAdminOverride());
    }

    private List<Project> selectProjects(String projectId) {
        if (projectId == null) {
            return new ArrayList<>(projectAccess.findAll());
        }
        Project project = projectAccess.findById(projectId)
                .orElseThrow(() -> RetentionException.projectNotFound(projectId));
        return new ArrayList<>(List.of(project));
    }

    private static Map<String, List<String>> byProject(List<BugReport> reports) {
        return reports.stream().collect(Collectors.groupingBy(BugReport::getProjectId, LinkedHashMap::new,
                Collectors.mapping(BugReport::getId, Collectors.toList())));
    }

    private static boolean pause(long delayMs) {
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static final class RunTotals {
        private int deleted;
        private int archived;
        private long storageFreed;
        private int screenshots;
        private int replays;
        private int projectsProcessed;
        private final List<RetentionError> errors = new ArrayList<>();

        void add(ProjectBatchResult result) {
            deleted += result.deleted();
            archived += result.archived();
            storageFreed += result.storageFreed();
            screenshots += result.screenshotsDeleted();
            replays += result.replaysDeleted();
            errors.addAll(result.errors());
        }

        void addPlan(ProjectPlan plan, RetentionPolicy policy) {
            int count = plan.reports().size();
            deleted += count;
            archived += policy.shouldArchiveBeforeDelete() ? count : 0;
            storageFreed += plan.estimatedBytes();
            screenshots += (int) plan.reports().stream().filter(BugReport::hasScreenshot).count();
            replays += (int) plan.reports().stream().filter(BugReport::hasReplay).count();
        }
    }
}
