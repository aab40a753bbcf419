package com.ai.salesbot.dto;

import com.ai.salesbot.utils.ObjectionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectionStats {
    private ObjectionType objectionType;
    private long count;
    private long resolved;
    private double resolutionRate;
    /** Seconds, over resolved objections only. */
    private double averageResolutionTime;
}
