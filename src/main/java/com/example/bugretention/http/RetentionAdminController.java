package com.example.bugretention.http;

import com.example.bugretention.config.RetentionProperties;
import com.example.bugretention.models.ProjectTier;
import com.example.bugretention.requests.ApplyRetentionHttpRequest;
import com.example.bugretention.requests.HardDeleteHttpRequest;
import com.example.bugretention.requests.HardDeleteServiceRequest;
import com.example.bugretention.requests.LegalHoldHttpRequest;
import com.example.bugretention.requests.LegalHoldServiceRequest;
import com.example.bugretention.requests.RestoreReportsHttpRequest;
import com.example.bugretention.requests.RestoreReportsServiceRequest;
import com.example.bugretention.service.ComplianceTables;
import com.example.bugretention.service.HardDeleteResult;
import com.example.bugretention.service.PolicyResolver;
import com.example.bugretention.service.RetentionPreview;
import com.example.bugretention.service.RetentionResult;
import com.example.bugretention.service.RetentionScheduler;
import com.example.bugretention.service.RetentionService;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administrative retention endpoints. Access control is enforced by the gateway in front of
 * this service; the caller's id is taken from {@code X-User-Id} for auditing.
 */
@RestController
@RequestMapping("/api/v1/admin/retention")
@Slf4j
public class RetentionAdminController {

    private final RetentionService retentionService;
    private final RetentionScheduler retentionScheduler;
    private final PolicyResolver policyResolver;
    private final ComplianceTables complianceTables;
    private final RetentionProperties properties;

    public RetentionAdminController(RetentionService retentionService,
                                    RetentionScheduler retentionScheduler,
                                    PolicyResolver policyResolver,
                                    ComplianceTables complianceTables,
                                    RetentionProperties properties) {
        this.retentionService = retentionService;
        this.retentionScheduler = retentionScheduler;
        this.policyResolver = policyResolver;
        this.complianceTables = complianceTables;
        this.properties = properties;
    }

    @GetMapping
    public ResponseEntity<RetentionStatusResponse> status() {
        Map<String, ComplianceTables.TierLimits> tiers = new LinkedHashMap<>();
        for (ProjectTier tier : ProjectTier.values()) {
            tiers.put(tier.wireValue(), complianceTables.tierLimits(tier));
        }
        RetentionProperties.Scheduler scheduler = properties.getScheduler();

        return ResponseEntity.ok(new RetentionStatusResponse(
                policyResolver.defaultPolicyFor(ProjectTier.FREE, properties.getDataClassification(),
                        properties.getComplianceRegion()),
                properties.getComplianceRegion(),
                tiers,
                properties.getConfirmationThreshold(),
                complianceTables.version(),
                new RetentionStatusResponse.Scheduler(
                        scheduler.isEnabled(),
                        scheduler.getCron(),
                        scheduler.getTimezone(),
                        retentionScheduler.isJobRunning(),
                        retentionScheduler.getNextRunTime())
        ));
    }

    @PostMapping("/preview")
    public ResponseEntity<RetentionPreview> preview(@RequestParam(value = "projectId", required = false) String projectId) {
        return ResponseEntity.ok(retentionService.previewRetentionPolicy(projectId));
    }

    @PostMapping("/apply")
    public ResponseEntity<RetentionResult> apply(
            @Valid @RequestBody(required = false) ApplyRetentionHttpRequest request,
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId
    ) {
        ApplyRetentionHttpRequest body = request != null
                ? request
                : new ApplyRetentionHttpRequest(null, null, null, null, null);
        String runId = "retention-run-" + UUID.randomUUID();
        log.info("[{}] Retention run requested by {} (dryRun={})", runId, userId, body.dryRun());

        return ResponseEntity.ok(retentionService.applyRetentionPolicies(body.toServiceRequest(runId)));
    }

    @PostMapping("/trigger")
    public ResponseEntity<Map<String, Object>> trigger(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId
    ) {
        log.info("Manual retention trigger requested by {}", userId);
        if (!retentionScheduler.triggerManual()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("code", "JOB_RUNNING", "message", "A retention job is already running"));
        }
        return ResponseEntity.ok(Map.of("success", true, "message", "Retention job completed"));
    }

    @PostMapping("/legal-hold")
    public ResponseEntity<ReportMutationResponse> legalHold(
            @Valid @RequestBody LegalHoldHttpRequest request,
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId
    ) {
        LegalHoldServiceRequest serviceRequest = new LegalHoldServiceRequest(request.reportIds(), request.hold(), userId);
        int affected = retentionService.setLegalHold(serviceRequest);
        return ResponseEntity.ok(new ReportMutationResponse(true, serviceRequest.reportIds().size(), affected));
    }

    @PostMapping("/restore")
    public ResponseEntity<ReportMutationResponse> restore(
            @Valid @RequestBody RestoreReportsHttpRequest request,
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId
    ) {
        RestoreReportsServiceRequest serviceRequest = new RestoreReportsServiceRequest(request.reportIds(), userId);
        int restored = retentionService.restoreReports(serviceRequest);
        return ResponseEntity.ok(new ReportMutationResponse(true, serviceRequest.reportIds().size(), restored));
    }

    @PostMapping("/hard-delete")
    public ResponseEntity<HardDeleteResponse> hardDelete(
            @Valid @RequestBody HardDeleteHttpRequest request,
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId
    ) {
        HardDeleteResult result = retentionService.hardDeleteReports(new HardDeleteServiceRequest(
                request.reportIds(), userId, null, request.certificateRequested()));

        return ResponseEntity.ok(new HardDeleteResponse(
                true,
                result.deletedCount(),
                DeletionCertificateResponse.from(result.certificate())
        ));
    }
}
