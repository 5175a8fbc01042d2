package com.example.bugretention.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import jakarta.validation.constraints.NotBlank;
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

/**
 * Project row as far as retention is concerned. {@code settings} is the raw stored document and
 * may contain keys unrelated to retention, or a retention block that fails validation.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor                     // required by DynamoDB Enhanced Client
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class Project {

    @NonNull
    @NotBlank
    private String id;

    @NonNull
    private String name;

    private Map<String, Object> settings;

    private Long createdAt;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("id")
    public String getId() { return id; }

    @DynamoDbAttribute("name")
    public String getName() { return name; }

    @DynamoDbAttribute("settings")
    @DynamoDbConvertedBy(JsonDocumentAttributeConverter.class)
    public Map<String, Object> getSettings() { return settings; }

    @DynamoDbAttribute("created_at")
    public Long getCreatedAt() { return createdAt; }
}
