package com.example.bugretention.access;

import com.example.bugretention.models.AuditEvent;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

@Component
public class DynamoAuditEventAccess implements AuditEventAccess {

    private final DynamoDbTable<AuditEvent> table;

    public DynamoAuditEventAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table("retention_audit_events", TableSchema.fromBean(AuditEvent.class));
    }

    @Override
    public void put(AuditEvent event) {
        table.putItem(event);
    }

    @Override
    public Optional<AuditEvent> findLatest(String projectId) {
        // Query the partition in reverse chronological order so the first item is the most recent.
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(buildKey(projectId)))
                        .limit(1)
                        .scanIndexForward(false))
                .items()
                .stream()
                .findFirst();
    }

    @Override
    public List<AuditEvent> findAllByProjectId(String projectId) {
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(buildKey(projectId)))
                        .scanIndexForward(true))
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    private Key buildKey(String projectId) {
        return Key.builder().partitionValue(projectId).build();
    }
}
