package com.example.bugretention.access;

import com.example.bugretention.models.DeletionCertificate;
import java.util.Optional;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

@Component
public class DynamoDeletionCertificateAccess implements DeletionCertificateAccess {

    private static final Expression NEW_CERTIFICATE = Expression.builder()
            .expression("attribute_not_exists(certificate_id)")
            .build();

    private final DynamoDbTable<DeletionCertificate> table;

    public DynamoDeletionCertificateAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table("deletion_certificates",
                TableSchema.fromBean(DeletionCertificate.class));
    }

    @Override
    public void save(WriteContext tx, DeletionCertificate certificate) {
        DynamoWriteTransaction.from(tx).put(table, DeletionCertificate.class, certificate, NEW_CERTIFICATE);
    }

    @Override
    public Optional<DeletionCertificate> findById(String certificateId) {
        return Optional.ofNullable(table.getItem(r -> r.key(Key.builder()
                .partitionValue(certificateId)
                .build())));
    }
}
