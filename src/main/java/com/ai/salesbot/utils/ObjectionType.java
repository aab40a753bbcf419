package com.ai.salesbot.utils;

import com.ai.salesbot.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Objection categories raised by a prospect during a sales call.
 */
public enum ObjectionType {
    PRICE("price"),
    TIMING("timing"),
    COMPETITION("competition"),
    TRUST("trust"),
    AUTHORITY("authority"),
    NEED("need"),
    BUDGET("budget"),
    URGENCY("urgency"),
    OTHER("other");

    private final String code;

    ObjectionType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ObjectionType fromCode(String code) {
        if (code == null || code.isBlank()) return null;
        for (ObjectionType t : values()) {
            if (t.code.equalsIgnoreCase(code.trim())) return t;
        }
        throw new ValidationException("Unknown objection type: " + code);
    }
}
