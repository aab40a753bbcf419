package com.ai.salesbot.dto;

import com.ai.salesbot.utils.ConversionStage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunnelReport {

    private long totalCalls;
    private List<StageCount> stages;
    /** Percentage of calls that reached CONVERTED. */
    private double conversionRate;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StageCount {
        private ConversionStage stage;
        private long count;
        private double percentage;
    }
}
