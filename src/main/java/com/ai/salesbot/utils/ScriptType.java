package com.ai.salesbot.utils;

/**
 * Conversation step a script is written for.
 */
public enum ScriptType {
    GREETING,
    QUALIFICATION,
    PRESENTATION,
    OBJECTION,
    CLOSING,
    UPSELL
}
