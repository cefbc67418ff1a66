package com.p14n.subsync.saga;

/**
 * Raised when a saga store cannot read or write its records.
 */
public class SagaStoreException extends RuntimeException {

    public SagaStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
