package com.example.bugretention.service;

import com.example.bugretention.access.AuditEventAccess;
import com.example.bugretention.models.AuditEvent;
import com.example.bugretention.models.DeletionReason;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AuditLogService {

    static final String ZERO_HASH = "0".repeat(64);

    private final AuditEventAccess auditEventAccess;
    private final Clock clock;

    public void recordArchive(String projectId, Collection<String> reportIds, Map<String, Object> details) {
        append(projectId, AuditEvent.Action.ARCHIVE, DeletionReason.RETENTION_POLICY, null, reportIds, details);
    }

    public void recordSoftDelete(String projectId,
                                 Collection<String> reportIds,
                                 DeletionReason reason,
                                 String userId,
                                 Map<String, Object> details) {
        append(projectId, AuditEvent.Action.SOFT_DELETE, reason, userId, reportIds, details);
    }

    public void recordHardDelete(String projectId,
                                 Collection<String> reportIds,
                                 String userId,
                                 String certificateId) {
        append(projectId, AuditEvent.Action.HARD_DELETE, DeletionReason.MANUAL, userId, reportIds,
                certificateId == null ? null : Map.of("certificate_id", certificateId));
    }

    public void recordRestore(String projectId, Collection<String> reportIds, String userId) {
        append(projectId, AuditEvent.Action.RESTORE, DeletionReason.MANUAL, userId, reportIds, null);
    }

    public void recordLegalHold(String projectId, Collection<String> reportIds, boolean hold, String userId) {
        append(projectId,
                hold ? AuditEvent.Action.LEGAL_HOLD_APPLIED : AuditEvent.Action.LEGAL_HOLD_RELEASED,
                hold ? DeletionReason.MANUAL : DeletionReason.LEGAL_HOLD_RELEASED,
                userId, reportIds, null);
    }

    /**
     * Walks the project's chain oldest first and checks every link and every stored hash.
     *
     * @return true when the chain is intact (an empty chain is intact)
     */
    public boolean verifyChain(String projectId) {
        String expectedPrev = ZERO_HASH;
        for (AuditEvent event : auditEventAccess.findAllByProjectId(projectId)) {
            if (!expectedPrev.equals(event.getPrevHash())) {
                return false;
            }
            if (!AuditEvent.computeHash(event).equals(event.getHash())) {
                return false;
            }
            expectedPrev = event.getHash();
        }
        return true;
    }

    /**
     * Appends an audit event, maintaining the per-project hash chain.
     */
    private void append(String projectId,
                        AuditEvent.Action action,
                        DeletionReason reason,
                        String userId,
                        Collection<String> reportIds,
                        Map<String, Object> details) {
        long now = clock.millis();
        Optional<AuditEvent> latest = auditEventAccess.findLatest(projectId);
        String prevHash = latest.map(AuditEvent::getHash).orElse(ZERO_HASH);

        AuditEvent event = AuditEvent.builder()
                .projectId(projectId)
                .tsUlid(nextSortKey(now, latest.map(AuditEvent::getTsUlid).orElse(null)))
                .action(action)
                .reason(reason)
                .userId(userId)
                .reportIds(reportIds == null ? List.of() : new ArrayList<>(reportIds))
                .timestamp(now)
                .prevHash(prevHash)
                .details(details)
                .build();

        auditEventAccess.put(event);
    }

    /**
     * Sort key "{millis}_{seq}_{random}" with a zero-padded millis and sequence. Events written
     * in the same millisecond as the latest one (or while the clock lags it) take the latest
     * millis with the next sequence, so keys always sort in append order.
     */
    static String nextSortKey(long now, String latestKey) {
        long millis = now;
        int seq = 0;
        if (latestKey != null) {
            String[] parts = latestKey.split("_");
            long latestMillis = Long.parseLong(parts[0]);
            if (latestMillis >= now) {
                millis = latestMillis;
                seq = parts.length == 3 ? Integer.parseInt(parts[1]) + 1 : 1;
            }
        }
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase();
        return String.format("%013d_%06d_%s", millis, seq, random);
    }
}
