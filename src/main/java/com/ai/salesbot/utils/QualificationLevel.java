package com.ai.salesbot.utils;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lead level derived from the BANT total. Thresholds are checked top-down.
 */
public enum QualificationLevel {
    HIGH("high", 30),
    MEDIUM("medium", 20),
    LOW("low", 10),
    UNQUALIFIED("unqualified", 0);

    private final String code;
    private final int threshold;

    QualificationLevel(String code, int threshold) {
        this.code = code;
        this.threshold = threshold;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getThreshold() {
        return threshold;
    }

    public static QualificationLevel forScore(int score) {
        if (score >= HIGH.threshold) return HIGH;
        if (score >= MEDIUM.threshold) return MEDIUM;
        if (score >= LOW.threshold) return LOW;
        return UNQUALIFIED;
    }
}
