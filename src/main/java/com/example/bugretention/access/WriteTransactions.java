package com.example.bugretention.access;

import java.util.function.Function;

/**
 * Runs a unit of work against a fresh transactional {@link WriteContext}. Staged writes are
 * committed only when {@code work} returns normally; an exception discards them.
 */
public interface WriteTransactions {

    /** Most writes one transaction may stage (the TransactWriteItems limit). */
    int MAX_ACTIONS = 100;

    <T> T execute(Function<WriteContext, T> work);
}
