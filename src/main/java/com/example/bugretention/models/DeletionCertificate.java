package com.example.bugretention.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Proof that a set of reports was permanently deleted. {@code verificationHash} covers the
 * substantive fields only, see {@code CertificateGenerator}.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class DeletionCertificate {

    @NonNull private String certificateId;
    @NonNull private String projectId;
    @NonNull private List<String> reportIds;
    @NonNull private Long deletedAt;
    @NonNull private String deletedBy;
    @NonNull private DeletionReason reason;
    @NonNull private DataClassification dataClassification;
    @NonNull private ComplianceRegion complianceRegion;
    @NonNull private String verificationHash;
    @NonNull private Long issuedAt;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("certificate_id")
    public String getCertificateId() { return certificateId; }

    @DynamoDbAttribute("project_id")
    public String getProjectId() { return projectId; }

    @DynamoDbAttribute("report_ids")
    public List<String> getReportIds() { return reportIds; }

    @DynamoDbAttribute("deleted_at")
    public Long getDeletedAt() { return deletedAt; }

    @DynamoDbAttribute("deleted_by")
    public String getDeletedBy() { return deletedBy; }

    @DynamoDbAttribute("reason")
    public DeletionReason getReason() { return reason; }

    @DynamoDbAttribute("data_classification")
    public DataClassification getDataClassification() { return dataClassification; }

    @DynamoDbAttribute("compliance_region")
    public ComplianceRegion getComplianceRegion() { return complianceRegion; }

    @DynamoDbAttribute("verification_hash")
    public String getVerificationHash() { return verificationHash; }

    @DynamoDbAttribute("issued_at")
    public Long getIssuedAt() { return issuedAt; }
}
