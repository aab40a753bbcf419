package com.ai.salesbot.utils;

public enum SalesMethod {
    SPIN,
    CONSULTATIVE,
    CHALLENGER,
    GENERIC
}
