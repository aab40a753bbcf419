package com.ai.salesbot.utils;

import com.ai.salesbot.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CallDirection {
    INBOUND("inbound"),
    OUTBOUND("outbound");

    private final String code;

    CallDirection(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static CallDirection fromCode(String code) {
        if (code == null || code.isBlank()) return null;
        for (CallDirection d : values()) {
            if (d.code.equalsIgnoreCase(code.trim())) return d;
        }
        throw new ValidationException("Unknown call direction: " + code);
    }
}
