package com.example.bugretention.service;

import lombok.Getter;

public class RetentionException extends RuntimeException {

    public enum Code {
        VALIDATION_FAILED,
        CONFIRMATION_REQUIRED,
        TRANSACTION_REQUIRED,
        TRANSACTION_ABORTED,
        PROJECT_NOT_FOUND,
        UNKNOWN
    }

    @Getter
    private final Code code;

    private RetentionException(Code code, String message) {
        super(message);
        this.code = code;
    }

    private RetentionException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static RetentionException validation(String message) {
        return new RetentionException(Code.VALIDATION_FAILED, message);
    }

    public static RetentionException confirmationRequired(long affectedReports, int threshold) {
        return new RetentionException(Code.CONFIRMATION_REQUIRED,
                "This operation will delete " + affectedReports + " reports (threshold " + threshold
                        + "). Set confirm=true to proceed");
    }

    public static RetentionException transactionRequired(String operation) {
        return new RetentionException(Code.TRANSACTION_REQUIRED,
                operation + " must run inside a write transaction");
    }

    public static RetentionException transactionAborted(String reason, Throwable cause) {
        return new RetentionException(Code.TRANSACTION_ABORTED,
                "Hard delete aborted: " + reason, cause);
    }

    public static RetentionException projectNotFound(String projectId) {
        return new RetentionException(Code.PROJECT_NOT_FOUND,
                "Project " + projectId + " does not exist");
    }
}
