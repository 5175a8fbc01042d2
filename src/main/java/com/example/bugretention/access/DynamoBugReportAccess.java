package com.example.bugretention.access;

import com.example.bugretention.models.BugReport;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.PutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.ScanEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

@Component
@Slf4j
public class DynamoBugReportAccess implements BugReportAccess {

    static final String TABLE_NAME = "bug_reports";

    private static final AttributeValue FALSE = AttributeValue.builder().bool(false).build();
    private static final AttributeValue TRUE = AttributeValue.builder().bool(true).build();

    private static final Expression ACTIVE_AND_NOT_HELD = Expression.builder()
            .expression("attribute_not_exists(#deleted) AND #hold = :false")
            .putExpressionName("#deleted", "deleted_at")
            .putExpressionName("#hold", "legal_hold")
            .putExpressionValue(":false", FALSE)
            .build();

    private static final Expression EXISTS_AND_NOT_HELD = Expression.builder()
            .expression("attribute_exists(#id) AND #hold = :false")
            .putExpressionName("#id", "id")
            .putExpressionName("#hold", "legal_hold")
            .putExpressionValue(":false", FALSE)
            .build();

    private static final Expression SOFT_DELETED = Expression.builder()
            .expression("attribute_exists(#deleted)")
            .putExpressionName("#deleted", "deleted_at")
            .build();

    private static final Expression EXISTS = Expression.builder()
            .expression("attribute_exists(#id)")
            .putExpressionName("#id", "id")
            .build();

    private static final int MAX_WRITE_ATTEMPTS = 3;

    private final DynamoDbTable<BugReport> table;

    public DynamoBugReportAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(BugReport.class));
    }

    @Override
    public Optional<BugReport> findById(String id) {
        return Optional.ofNullable(table.getItem(r -> r.key(buildKey(id)).consistentRead(true)));
    }

    @Override
    public List<BugReport> findEligibleForDeletion(String projectId, long cutoffMillis) {
        QueryEnhancedRequest request = QueryEnhancedRequest.builder()
                .queryConditional(QueryConditional.sortLessThan(Key.builder()
                        .partitionValue(projectId)
                        .sortValue(cutoffMillis)
                        .build()))
                .filterExpression(ACTIVE_AND_NOT_HELD)
                .scanIndexForward(true)
                .build();

        return table.index(BugReport.PROJECT_INDEX)
                .query(request)
                .stream()
                .flatMap(page -> page.items().stream())
                .collect(Collectors.toList());
    }

    @Override
    public List<BugReport> findByIds(Collection<String> ids) {
        List<BugReport> found = new ArrayList<>();
        for (String id : new LinkedHashSet<>(ids)) {
            findById(id).ifPresent(found::add);
        }
        return found;
    }

    @Override
    public int softDelete(Collection<String> ids, String userId, long deletedAtMillis) {
        int changed = 0;
        for (String id : new LinkedHashSet<>(ids)) {
            Optional<BugReport> written = writeIfApplicable(id,
                    r -> !r.isSoftDeleted() && !r.isOnLegalHold(),
                    r -> r.markSoftDeleted(deletedAtMillis, userId),
                    ACTIVE_AND_NOT_HELD);
            if (written.isPresent()) {
                changed++;
            }
        }
        return changed;
    }

    @Override
    public List<BugReport> restore(Collection<String> ids) {
        List<BugReport> restored = new ArrayList<>();
        for (String id : new LinkedHashSet<>(ids)) {
            writeIfApplicable(id, BugReport::isSoftDeleted, BugReport::clearDeletion, SOFT_DELETED)
                    .ifPresent(restored::add);
        }
        return restored;
    }

    @Override
    public int hardDelete(WriteContext tx, Collection<String> ids) {
        DynamoWriteTransaction dynamoTx = DynamoWriteTransaction.from(tx);
        int staged = 0;
        for (String id : new LinkedHashSet<>(ids)) {
            dynamoTx.delete(table, buildKey(id), EXISTS_AND_NOT_HELD);
            staged++;
        }
        return staged;
    }

    @Override
    public List<BugReport> setLegalHold(Collection<String> ids, boolean hold) {
        List<BugReport> changed = new ArrayList<>();
        for (String id : new LinkedHashSet<>(ids)) {
            writeIfApplicable(id,
                    r -> r.isOnLegalHold() != hold,
                    r -> {
                        r.setLegalHold(hold);
                        return r;
                    },
                    EXISTS)
                    .ifPresent(changed::add);
        }
        return changed;
    }

    @Override
    public long countLegalHoldReports() {
        Expression onHold = Expression.builder()
                .expression("#hold = :true")
                .putExpressionName("#hold", "legal_hold")
                .putExpressionValue(":true", TRUE)
                .build();

        return table.scan(ScanEnhancedRequest.builder().filterExpression(onHold).build())
                .items()
                .stream()
                .count();
    }

    @Override
    public BugReport save(BugReport report) {
        table.putItem(report);
        return report;
    }

    /**
     * Reads the row, applies {@code change} when {@code applies} holds and writes it back. The
     * put carries the row's version, so a concurrent writer makes it fail; the row is then re-read
     * and the check repeated.
     *
     * @return the written row, or empty when the row is missing, no longer applies, or kept
     *         changing
     */
    private Optional<BugReport> writeIfApplicable(String id,
                                                  Predicate<BugReport> applies,
                                                  UnaryOperator<BugReport> change,
                                                  Expression condition) {
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            Optional<BugReport> existing = findById(id);
            if (existing.isEmpty() || !applies.test(existing.get())) {
                return Optional.empty();
            }
            BugReport updated = change.apply(existing.get());
            try {
                table.putItem(PutItemEnhancedRequest.builder(BugReport.class)
                        .item(updated)
                        .conditionExpression(condition)
                        .build());
                return Optional.of(updated);
            } catch (ConditionalCheckFailedException ex) {
                log.debug("Report {} changed during write (attempt {}): {}", id, attempt, ex.getMessage());
            }
        }
        log.warn("Report {} kept changing, giving up after {} attempts", id, MAX_WRITE_ATTEMPTS);
        return Optional.empty();
    }

    private Key buildKey(String id) {
        return Key.builder().partitionValue(id).build();
    }
}
