package com.example.bugretention.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.extensions.annotations.DynamoDbVersionAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondarySortKey;

/**
 * Lifecycle view of a stored bug report. A row is ACTIVE while {@code deletedAt} is null,
 * SOFT_DELETED once it is set, and HARD_DELETED when the item no longer exists.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor                     // needed for DynamoDB Enhanced Client reflection
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class BugReport {

    public static final String PROJECT_INDEX = "reports_by_project";

    // Required; the builder null-checks these
    @NonNull
    private String id;

    @NonNull
    private String projectId;

    @NonNull
    private Long createdAt;

    private String title;
    private String screenshotUrl;
    private String replayUrl;

    // Lifecycle fields
    private Long deletedAt;
    private String deletedBy;

    @NonNull
    @Default
    private Boolean legalHold = Boolean.FALSE;

    // Optimistic lock, bumped by the enhanced client on every put
    private Long version;

    // ----- DynamoDB Enhanced annotations on getters -----

    @DynamoDbPartitionKey
    @DynamoDbAttribute("id")
    public String getId() { return id; }

    @DynamoDbAttribute("project_id")
    @DynamoDbSecondaryPartitionKey(indexNames = PROJECT_INDEX)
    public String getProjectId() { return projectId; }

    @DynamoDbAttribute("created_at")
    @DynamoDbSecondarySortKey(indexNames = PROJECT_INDEX)
    public Long getCreatedAt() { return createdAt; }

    @DynamoDbAttribute("title")
    public String getTitle() { return title; }

    @DynamoDbAttribute("screenshot_url")
    public String getScreenshotUrl() { return screenshotUrl; }

    @DynamoDbAttribute("replay_url")
    public String getReplayUrl() { return replayUrl; }

    @DynamoDbAttribute("deleted_at")
    public Long getDeletedAt() { return deletedAt; }

    @DynamoDbAttribute("deleted_by")
    public String getDeletedBy() { return deletedBy; }

    @DynamoDbAttribute("legal_hold")
    public Boolean getLegalHold() { return legalHold; }

    @JsonIgnore
    @DynamoDbVersionAttribute
    @DynamoDbAttribute("version")
    public Long getVersion() { return version; }

    // ----- Domain helpers -----

    @DynamoDbIgnore
    @JsonIgnore
    public boolean isSoftDeleted() {
        return deletedAt != null;
    }

    @DynamoDbIgnore
    @JsonIgnore
    public boolean isOnLegalHold() {
        return Boolean.TRUE.equals(legalHold);
    }

    public boolean hasScreenshot() {
        return screenshotUrl != null && !screenshotUrl.isBlank();
    }

    public boolean hasReplay() {
        return replayUrl != null && !replayUrl.isBlank();
    }

    public BugReport markSoftDeleted(long deletedAtMillis, String deletedByUser) {
        if (isOnLegalHold()) {
            throw new IllegalStateException("Report " + id + " is on legal hold");
        }
        this.deletedAt = deletedAtMillis;
        this.deletedBy = deletedByUser;
        return this;
    }

    public BugReport clearDeletion() {
        this.deletedAt = null;
        this.deletedBy = null;
        return this;
    }
}
