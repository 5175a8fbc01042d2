package com.example.bugretention.http;

import com.example.bugretention.requests.UpdateRetentionPolicyHttpRequest;
import com.example.bugretention.requests.UpdateRetentionServiceRequest;
import com.example.bugretention.service.RetentionService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Per-project retention settings. Administrators ({@code X-User-Role: admin}) may store periods
 * outside their tier's bounds; nobody may go below the compliance minimum.
 */
@RestController
public class ProjectRetentionController {

    private final RetentionService retentionService;

    public ProjectRetentionController(RetentionService retentionService) {
        this.retentionService = retentionService;
    }

    @GetMapping("/api/v1/projects/{projectId}/retention")
    public ResponseEntity<ProjectRetentionResponse> getRetention(@PathVariable String projectId) {
        return ResponseEntity.ok(ProjectRetentionResponse.from(retentionService.getProjectRetention(projectId)));
    }

    @PutMapping("/api/v1/projects/{projectId}/retention")
    public ResponseEntity<ProjectRetentionResponse> putRetention(
            @PathVariable String projectId,
            @Valid @RequestBody UpdateRetentionPolicyHttpRequest request,
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @RequestHeader(value = CallerHeaders.USER_ROLE, required = false) String role
    ) {
        UpdateRetentionServiceRequest serviceRequest = new UpdateRetentionServiceRequest(
                projectId, request.toPolicy(), request.tier(), userId, CallerHeaders.isAdmin(role));
        return ResponseEntity.ok(ProjectRetentionResponse.from(retentionService.updateProjectRetention(serviceRequest)));
    }
}
