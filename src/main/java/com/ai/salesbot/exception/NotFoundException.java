package com.ai.salesbot.exception;

/**
 * A call session, script, handler, product or configuration entry does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String what, Object key) {
        return new NotFoundException(what + " not found: " + key);
    }
}
