package com.example.bugretention.access;

import com.example.bugretention.models.Project;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

@Component
public class DynamoProjectAccess implements ProjectAccess {

    private final DynamoDbTable<Project> table;

    public DynamoProjectAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table("projects", TableSchema.fromBean(Project.class));
    }

    @Override
    public List<Project> findAll() {
        // Scan order is undefined; sort so runs visit projects deterministically.
        return table.scan()
                .items()
                .stream()
                .sorted(Comparator.comparing(Project::getId))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Project> findById(String projectId) {
        return Optional.ofNullable(table.getItem(r -> r.key(Key.builder()
                .partitionValue(projectId)
                .build())));
    }

    @Override
    public Project save(Project project) {
        table.putItem(project);
        return project;
    }
}
