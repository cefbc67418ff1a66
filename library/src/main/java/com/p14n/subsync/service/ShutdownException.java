package com.p14n.subsync.service;

/**
 * Raised when the subscription service could not release its resources
 * cleanly.
 */
public class ShutdownException extends RuntimeException {

    public ShutdownException(String message, Throwable cause) {
        super(message, cause);
    }
}
