package com.example.bugretention.access;

import java.util.function.Function;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;

@Component
public class DynamoWriteTransactions implements WriteTransactions {

    private final DynamoDbEnhancedClient enhancedClient;

    public DynamoWriteTransactions(DynamoDbEnhancedClient enhancedClient) {
        this.enhancedClient = enhancedClient;
    }

    @Override
    public <T> T execute(Function<WriteContext, T> work) {
        DynamoWriteTransaction tx = new DynamoWriteTransaction();
        T result = work.apply(tx);
        tx.commit(enhancedClient);
        return result;
    }
}
