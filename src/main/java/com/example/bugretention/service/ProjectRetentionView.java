package com.example.bugretention.service;

import com.example.bugretention.models.ProjectTier;
import com.example.bugretention.models.RetentionPolicy;
import com.example.bugretention.service.ComplianceTables.TierLimits;

/**
 * A project's retention settings as stored, next to the policy the engine would apply.
 */
public record ProjectRetentionView(String projectId,
                                   ProjectTier tier,
                                   RetentionPolicy storedPolicy,
                                   RetentionPolicy effectivePolicy,
                                   int minimumRetentionDays,
                                   TierLimits tierLimits,
                                   boolean adminOverride) { }
