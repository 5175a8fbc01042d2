package com.example.bugretention.requests;

import com.example.bugretention.models.ProjectTier;
import com.example.bugretention.models.RetentionPolicy;
import java.util.Objects;

/**
 * Partial update of a project's retention settings. Null fields in {@code policy} keep their
 * stored value; a null {@code tier} keeps the stored tier.
 */
public record UpdateRetentionServiceRequest(
        String projectId,
        RetentionPolicy policy,
        ProjectTier tier,
        String userId,
        boolean isAdmin
) {

    public UpdateRetentionServiceRequest {
        Objects.requireNonNull(projectId, "projectId");
        if (projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must be non-blank");
        }
        policy = policy == null ? new RetentionPolicy() : policy;
    }
}
