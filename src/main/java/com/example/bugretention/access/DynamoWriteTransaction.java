package com.example.bugretention.access;

import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.MappedTableResource;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactDeleteItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactPutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactWriteItemsEnhancedRequest;

/**
 * Buffers deletes and puts for a single DynamoDB TransactWriteItems call.
 */
public class DynamoWriteTransaction implements WriteContext {

    public static final int MAX_ACTIONS = WriteTransactions.MAX_ACTIONS;

    private final TransactWriteItemsEnhancedRequest.Builder request =
            TransactWriteItemsEnhancedRequest.builder();
    private int actions;
    private boolean committed;

    @Override
    public boolean isTransactional() {
        return true;
    }

    public static DynamoWriteTransaction from(WriteContext context) {
        if (context instanceof DynamoWriteTransaction tx) {
            return tx;
        }
        throw new IllegalStateException("A DynamoDB write transaction is required, got "
                + (context == null ? "null" : context.getClass().getSimpleName()));
    }

    public <T> void delete(MappedTableResource<T> table, Key key, Expression condition) {
        reserveAction();
        request.addDeleteItem(table, TransactDeleteItemEnhancedRequest.builder()
                .key(key)
                .conditionExpression(condition)
                .build());
    }

    public <T> void put(MappedTableResource<T> table, Class<T> itemClass, T item, Expression condition) {
        reserveAction();
        request.addPutItem(table, TransactPutItemEnhancedRequest.builder(itemClass)
                .item(item)
                .conditionExpression(condition)
                .build());
    }

    public int size() {
        return actions;
    }

    void commit(DynamoDbEnhancedClient enhancedClient) {
        if (committed) {
            throw new IllegalStateException("Transaction already committed");
        }
        committed = true;
        if (actions > 0) {
            enhancedClient.transactWriteItems(request.build());
        }
    }

    private void reserveAction() {
        if (committed) {
            throw new IllegalStateException("Transaction already committed");
        }
        if (actions >= MAX_ACTIONS) {
            throw new IllegalArgumentException(
                    "Transaction exceeds " + MAX_ACTIONS + " write actions; split the request");
        }
        actions++;
    }
}
