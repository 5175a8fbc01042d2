package com.example.bugretention.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonValue;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * Append-only record of a retention action. Events form a hash chain per project: each event
 * carries the hash of its predecessor, so removing or editing an entry breaks the chain.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class AuditEvent {

    // Required; the builder null-checks these
    @NonNull private String projectId;   // PK
    @NonNull private String tsUlid;      // SK "{millis}_{seq}_{random}"
    @NonNull private Action action;
    @NonNull private DeletionReason reason;
    @NonNull private Long timestamp;
    @NonNull private String prevHash;

    // computed in build()
    private String hash;

    // Optional fields
    private String userId;
    private List<String> reportIds;
    private Map<String, Object> details;

    // ----- DynamoDB annotations on getters -----
    @DynamoDbPartitionKey
    @DynamoDbAttribute("project_id")
    public String getProjectId() { return projectId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("ts_ulid")
    public String getTsUlid() { return tsUlid; }

    @DynamoDbAttribute("action")
    public Action getAction() { return action; }

    @DynamoDbAttribute("reason")
    public DeletionReason getReason() { return reason; }

    @DynamoDbAttribute("timestamp")
    public Long getTimestamp() { return timestamp; }

    @DynamoDbAttribute("prev_hash")
    public String getPrevHash() { return prevHash; }

    @DynamoDbAttribute("hash")
    public String getHash() { return hash; }

    @DynamoDbAttribute("user_id")
    public String getUserId() { return userId; }

    @DynamoDbAttribute("report_ids")
    public List<String> getReportIds() { return reportIds; }

    @DynamoDbConvertedBy(JsonDocumentAttributeConverter.class)
    @DynamoDbAttribute("details")
    public Map<String, Object> getDetails() { return details; }

    public enum Action {
        SOFT_DELETE("soft_delete"),
        HARD_DELETE("hard_delete"),
        ARCHIVE("archive"),
        RESTORE("restore"),
        LEGAL_HOLD_APPLIED("legal_hold_applied"),
        LEGAL_HOLD_RELEASED("legal_hold_released");

        private final String wireValue;

        Action(String wireValue) {
            this.wireValue = wireValue;
        }

        @JsonValue
        public String wireValue() {
            return wireValue;
        }

        @JsonCreator
        public static Action fromString(String v) {
            for (Action a : values()) {
                if (a.wireValue.equals(v) || a.name().equals(v)) {
                    return a;
                }
            }
            throw new IllegalArgumentException("Unknown AuditEvent.Action: " + v);
        }
    }

    // hash chain helpers
    public static String computeHash(AuditEvent e) {
        String detailsJson = JsonDocumentAttributeConverter.toJsonString(
                e.details == null ? Collections.emptyMap() : e.details
        );
        String canon = String.join("|",
                nn(e.projectId),
                nn(e.tsUlid),
                e.action == null ? "" : e.action.wireValue(),
                e.reason == null ? "" : e.reason.wireValue(),
                nn(e.userId),
                e.reportIds == null ? "" : String.join(",", e.reportIds),
                e.timestamp == null ? "" : String.valueOf(e.timestamp),
                detailsJson,
                nn(e.prevHash)
        );
        return sha256Hex(canon);
    }

    public static String sha256Hex(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return bytesToHex(md.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private static String nn(String s) { return s == null ? "" : s; }

    private static String bytesToHex(byte[] bytes) {
        final char[] HEX = "0123456789abcdef".toCharArray();
        char[] out = new char[bytes.length * 2];
        for (int i = 0, j = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0F];
        }
        return new String(out);
    }

    public static class AuditEventBuilder {
        public AuditEvent build() {
            AuditEvent e = new AuditEvent(
                    projectId, tsUlid, action, reason, timestamp, prevHash,
                    null, userId, reportIds, details
            );
            e.hash = computeHash(e);
            return e;
        }
    }
}
