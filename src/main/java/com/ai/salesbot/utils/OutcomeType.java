package com.ai.salesbot.utils;

public enum OutcomeType {
    CONVERTED,
    NOT_INTERESTED,
    CALLBACK,
    FOLLOW_UP,
    OBJECTION_UNRESOLVED,
    NO_ANSWER
}
