package com.ai.salesbot.exception;

/**
 * Rejected input. Thrown before any state is touched.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
