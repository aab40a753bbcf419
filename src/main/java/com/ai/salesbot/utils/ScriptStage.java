package com.ai.salesbot.utils;

/**
 * SPIN question stage, plus the generic presentation and closing stages.
 */
public enum ScriptStage {
    SITUATION,
    PROBLEM,
    IMPLICATION,
    NEED_PAYOFF,
    PRESENTATION,
    CLOSING
}
