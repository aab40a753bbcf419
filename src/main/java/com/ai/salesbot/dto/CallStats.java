package com.ai.salesbot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallStats {
    private long totalCalls;
    private long successfulCalls;
    private long failedCalls;
    private long missedCalls;
    private long inProgressCalls;
    /** Percentage of calls that ended in success, one decimal. */
    private double successRate;
    private double averageDuration;
    private long totalDuration;
}
