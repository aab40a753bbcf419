package com.ai.salesbot.utils;

import com.ai.salesbot.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Call lifecycle. IN_PROGRESS is the only non-terminal state; every other state is absorbing.
 */
public enum CallStatus {
    IN_PROGRESS("in-progress"),
    SUCCESS("success"),
    FAILED("failed"),
    MISSED("missed");

    private final String code;

    CallStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    @JsonCreator
    public static CallStatus fromCode(String code) {
        if (code == null || code.isBlank()) return null;
        for (CallStatus s : values()) {
            if (s.code.equalsIgnoreCase(code.trim()) || s.name().equalsIgnoreCase(code.trim())) {
                return s;
            }
        }
        throw new ValidationException("Unknown call status: " + code);
    }
}
