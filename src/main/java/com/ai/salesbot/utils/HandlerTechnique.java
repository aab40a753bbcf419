package com.ai.salesbot.utils;

/**
 * Rhetorical technique an objection handler response relies on.
 */
public enum HandlerTechnique {
    EMPATHY_REFRAME,
    VALUE_REINFORCEMENT,
    SOCIAL_PROOF,
    URGENCY,
    ALTERNATIVE,
    QUESTION
}
