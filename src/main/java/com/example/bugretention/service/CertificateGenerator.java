package com.example.bugretention.service;

import com.example.bugretention.models.AuditEvent;
import com.example.bugretention.models.ComplianceRegion;
import com.example.bugretention.models.DataClassification;
import com.example.bugretention.models.DeletionCertificate;
import com.example.bugretention.models.DeletionReason;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Issues deletion certificates whose {@code verificationHash} a third party can recompute.
 *
 * <p>The hash is the lowercase hex SHA-256 of a compact JSON object with exactly these keys in
 * lexicographic order: {@code complianceRegion}, {@code dataClassification}, {@code deletedAt}
 * (ISO-8601 instant in UTC), {@code deletedBy}, {@code projectId}, {@code reason} and
 * {@code reportIds} (sorted ascending). Enum values use their lowercase wire names.
 * {@code certificateId} and {@code issuedAt} are not covered.
 */
@Component
@RequiredArgsConstructor
public class CertificateGenerator {

    public static final String SYSTEM_USER = "system";

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .build();

    private final Clock clock;

    public DeletionCertificate issue(String projectId,
                                     Collection<String> reportIds,
                                     String deletedBy,
                                     DeletionReason reason,
                                     DataClassification classification,
                                     ComplianceRegion region) {
        long now = clock.millis();
        List<String> ids = new ArrayList<>(reportIds);
        String actor = deletedBy == null || deletedBy.isBlank() ? SYSTEM_USER : deletedBy;

        return DeletionCertificate.builder()
                .certificateId(UUID.randomUUID().toString())
                .projectId(projectId)
                .reportIds(ids)
                .deletedAt(now)
                .deletedBy(actor)
                .reason(reason)
                .dataClassification(classification)
                .complianceRegion(region)
                .verificationHash(computeHash(projectId, ids, now, actor, reason, classification, region))
                .issuedAt(now)
                .build();
    }

    /**
     * @return true when the stored hash matches the certificate's current content
     */
    public boolean verify(DeletionCertificate certificate) {
        String expected = computeHash(
                certificate.getProjectId(),
                certificate.getReportIds(),
                certificate.getDeletedAt(),
                certificate.getDeletedBy(),
                certificate.getReason(),
                certificate.getDataClassification(),
                certificate.getComplianceRegion());
        return expected.equals(certificate.getVerificationHash());
    }

    static String canonicalJson(String projectId,
                                List<String> reportIds,
                                long deletedAtMillis,
                                String deletedBy,
                                DeletionReason reason,
                                DataClassification classification,
                                ComplianceRegion region) {
        Map<String, Object> content = new TreeMap<>();
        content.put("complianceRegion", region.wireValue());
        content.put("dataClassification", classification.wireValue());
        content.put("deletedAt", Instant.ofEpochMilli(deletedAtMillis).toString());
        content.put("deletedBy", deletedBy);
        content.put("projectId", projectId);
        content.put("reason", reason.wireValue());
        content.put("reportIds", reportIds.stream().sorted().toList());
        try {
            return CANONICAL.writeValueAsString(content);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialize certificate content", ex);
        }
    }

    private static String computeHash(String projectId,
                                      List<String> reportIds,
                                      long deletedAtMillis,
                                      String deletedBy,
                                      DeletionReason reason,
                                      DataClassification classification,
                                      ComplianceRegion region) {
        return AuditEvent.sha256Hex(
                canonicalJson(projectId, reportIds, deletedAtMillis, deletedBy, reason, classification, region));
    }
}
