package com.credvault.api.exception;

import lombok.Getter;

/**
 * Unified exception for document store failures.
 */
@Getter
public class StoreException extends RuntimeException {

    private final String collection;
    private final ErrorType errorType;

    public enum ErrorType {
        DATABASE_NOT_CONFIGURED,
        EXECUTION_ERROR
    }

    public StoreException(String message, String collection, ErrorType errorType) {
        super(message);
        this.collection = collection;
        this.errorType = errorType;
    }

    public StoreException(String message, String collection, ErrorType errorType, Throwable cause) {
        super(message, cause);
        this.collection = collection;
        this.errorType = errorType;
    }

    /**
     * Wraps a driver failure, keeping the underlying error text as the message.
     */
    public static StoreException executionError(String collection, Exception cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.toString();
        return new StoreException(message, collection, ErrorType.EXECUTION_ERROR, cause);
    }
}
