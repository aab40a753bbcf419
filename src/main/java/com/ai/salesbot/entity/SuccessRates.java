package com.ai.salesbot.entity;

/**
 * Success rate bookkeeping shared by scripts and objection handlers.
 */
final class SuccessRates {

    private SuccessRates() {
    }

    /**
     * Cumulative mean of all outcomes so far, every use weighted equally.
     * {@code usageCount} already includes the outcome being added.
     */
    static int cumulativeMean(int previousRate, int usageCount, boolean success) {
        if (usageCount <= 0) return previousRate;
        double next = ((double) previousRate * (usageCount - 1) + (success ? 100 : 0)) / usageCount;
        return (int) Math.max(0, Math.min(100, Math.round(next)));
    }
}
