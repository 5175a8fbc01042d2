package com.example.bugretention.access;

/**
 * Handle passed to writes that must be atomic. A transactional context buffers the staged
 * operations and applies them together on commit; the non-transactional context exists so
 * callers that require a transaction can detect and reject it.
 */
public interface WriteContext {

    boolean isTransactional();

    static WriteContext nonTransactional() {
        return NonTransactional.INSTANCE;
    }

    enum NonTransactional implements WriteContext {
        INSTANCE;

        @Override
        public boolean isTransactional() {
            return false;
        }
    }
}
