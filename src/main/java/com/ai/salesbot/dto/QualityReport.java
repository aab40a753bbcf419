package com.ai.salesbot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Call quality distribution: excellent is 80 and above, good 60 to 79, the rest need improvement.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityReport {
    private long totalCalls;
    private double averageScore;
    private long excellent;
    private long good;
    private long needsImprovement;
    private double averageTalkListen;
    private double averageSentimentTrend;
    private double averageStageCompletion;
    private double averageObjectionResolution;
}
