package com.example.bugretention.http;

import com.example.bugretention.models.ComplianceRegion;
import com.example.bugretention.models.DataClassification;
import com.example.bugretention.models.DeletionCertificate;
import com.example.bugretention.models.DeletionReason;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

public record DeletionCertificateResponse(
        @JsonProperty("certificateId") String certificateId,
        @JsonProperty("projectId") String projectId,
        @JsonProperty("reportIds") List<String> reportIds,
        @JsonProperty("deletedAt") Instant deletedAt,
        @JsonProperty("deletedBy") String deletedBy,
        @JsonProperty("reason") DeletionReason reason,
        @JsonProperty("dataClassification") DataClassification dataClassification,
        @JsonProperty("complianceRegion") ComplianceRegion complianceRegion,
        @JsonProperty("verificationHash") String verificationHash,
        @JsonProperty("issuedAt") Instant issuedAt
) {
    static DeletionCertificateResponse from(DeletionCertificate certificate) {
        if (certificate == null) {
            return null;
        }
        return new DeletionCertificateResponse(
                certificate.getCertificateId(),
                certificate.getProjectId(),
                certificate.getReportIds(),
                Instant.ofEpochMilli(certificate.getDeletedAt()),
                certificate.getDeletedBy(),
                certificate.getReason(),
                certificate.getDataClassification(),
                certificate.getComplianceRegion(),
                certificate.getVerificationHash(),
                Instant.ofEpochMilli(certificate.getIssuedAt())
        );
    }
}
