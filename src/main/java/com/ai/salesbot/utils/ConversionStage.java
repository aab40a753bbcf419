package com.ai.salesbot.utils;

/**
 * Conversion funnel. The first six entries form the canonical funnel used for stage completion;
 * LOST is an exit, not a step.
 */
public enum ConversionStage {
    GREETING,
    QUALIFICATION,
    PRESENTATION,
    OBJECTION,
    CLOSING,
    CONVERTED,
    LOST;

    public static final int CANONICAL_FUNNEL_LENGTH = 6;
}
