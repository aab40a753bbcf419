package com.ai.salesbot.utils;

/**
 * Where the lead stands in the qualification conversation.
 */
public enum QualificationStage {
    INITIAL,
    QUALIFIED,
    PRESENTATION,
    OBJECTION,
    CLOSING,
    CONVERTED,
    LOST
}
