package com.ai.salesbot.utils;

import com.ai.salesbot.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Spoken language tag: English, Hindi, or mixed (Hinglish).
 */
public enum Language {
    EN("en"),
    HI("hi"),
    MIXED("mixed");

    private final String code;

    Language(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static Language fromCode(String code) {
        if (code == null || code.isBlank()) return null;
        for (Language l : values()) {
            if (l.code.equalsIgnoreCase(code.trim())) return l;
        }
        throw new ValidationException("Unsupported language: " + code);
    }
}
