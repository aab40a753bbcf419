package com.ai.salesbot.utils;

import com.ai.salesbot.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Satisfaction {
    POSITIVE("positive"),
    NEGATIVE("negative"),
    NEUTRAL("neutral"),
    UNKNOWN("unknown");

    private final String code;

    Satisfaction(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static Satisfaction fromCode(String code) {
        if (code == null || code.isBlank()) return null;
        for (Satisfaction s : values()) {
            if (s.code.equalsIgnoreCase(code.trim())) return s;
        }
        throw new ValidationException("Unknown satisfaction: " + code);
    }
}
