package com.ai.salesbot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TalkListenReport {
    private long totalCalls;
    private double averageRatio;
    private double targetRatio;
    /** Calls with a ratio between 0.3 and 0.5. */
    private long optimalCalls;
    private double optimalPercentage;
    private double averageAiTalkTime;
    private double averageUserTalkTime;
}
