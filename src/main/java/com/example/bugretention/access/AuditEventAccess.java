package com.example.bugretention.access;

import com.example.bugretention.models.AuditEvent;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for the append-only {@code retention_audit_events} table. Implementations
 * persist events and return the latest one for a project so the service layer can maintain the
 * hash chain.
 */
public interface AuditEventAccess {
    void put(AuditEvent event);

    Optional<AuditEvent> findLatest(String projectId);

    /**
     * Finds all audit events of a project, oldest first. Used for chain verification and audit
     * export.
     */
    List<AuditEvent> findAllByProjectId(String projectId);
}
