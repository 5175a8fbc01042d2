package com.example.bugretention.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.bugretention.models.AuditEvent;
import com.example.bugretention.models.ComplianceRegion;
import com.example.bugretention.models.DataClassification;
import com.example.bugretention.models.DeletionCertificate;
import com.example.bugretention.models.DeletionReason;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CertificateGeneratorTest {

    private final CertificateGenerator generator = new CertificateGenerator(RetentionFixtures.CLOCK);

    @Test
    @DisplayName("hash is the SHA-256 of the documented canonical JSON")
    void hashIsRecomputable() {
        DeletionCertificate certificate = generator.issue("p1", List.of("b", "a"), "admin-1",
                DeletionReason.GDPR_REQUEST, DataClassification.PII, ComplianceRegion.EU);

        String expectedJson = "{\"complianceRegion\":\"eu\",\"dataClassification\":\"pii\","
                + "\"deletedAt\":\"2025-03-01T02:00:00Z\",\"deletedBy\":\"admin-1\",\"projectId\":\"p1\","
                + "\"reason\":\"gdpr_request\",\"reportIds\":[\"a\",\"b\"]}";

        assertEquals(expectedJson, CertificateGenerator.canonicalJson("p1", List.of("b", "a"),
                RetentionFixtures.NOW, "admin-1", DeletionReason.GDPR_REQUEST,
                DataClassification.PII, ComplianceRegion.EU));
        assertEquals(AuditEvent.sha256Hex(expectedJson), certificate.getVerificationHash());
        assertEquals(64, certificate.getVerificationHash().length());
        assertTrue(generator.verify(certificate));
    }

    @Test
    @DisplayName("blank deletedBy is recorded as system")
    void defaultsDeletedBy() {
        DeletionCertificate certificate = generator.issue("p1", List.of("a"), " ",
                DeletionReason.RETENTION_POLICY, DataClassification.GENERAL, ComplianceRegion.KZ);

        assertEquals("system", certificate.getDeletedBy());
        assertEquals(RetentionFixtures.NOW, certificate.getIssuedAt());
    }

    @Test
    @DisplayName("report id order does not change the hash")
    void orderInsensitive() {
        DeletionCertificate first = generator.issue("p1", List.of("a", "b", "c"), "u",
                DeletionReason.MANUAL, DataClassification.GENERAL, ComplianceRegion.NONE);
        DeletionCertificate second = generator.issue("p1", List.of("c", "a", "b"), "u",
                DeletionReason.MANUAL, DataClassification.GENERAL, ComplianceRegion.NONE);

        assertEquals(first.getVerificationHash(), second.getVerificationHash());
        assertNotEquals(first.getCertificateId(), second.getCertificateId());
    }

    @Test
    @DisplayName("tampering with any covered field fails verification")
    void tamperDetected() {
        DeletionCertificate certificate = generator.issue("p1", List.of("a", "b"), "u",
                DeletionReason.MANUAL, DataClassification.GENERAL, ComplianceRegion.US);

        assertFalse(generator.verify(certificate.toBuilder().reportIds(List.of("a")).build()));
        assertFalse(generator.verify(certificate.toBuilder().deletedBy("someone-else").build()));
        assertFalse(generator.verify(certificate.toBuilder().deletedAt(certificate.getDeletedAt() + 1).build()));
        assertTrue(generator.verify(certificate.toBuilder().issuedAt(0L).build()));
    }
}
