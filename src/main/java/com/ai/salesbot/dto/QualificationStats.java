package com.ai.salesbot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualificationStats {
    private long totalLeads;
    private double averageScore;
    /** Score of 20 or more. */
    private long qualifiedLeads;
    /** Score of 30 or more. */
    private long highQualifiedLeads;
    private long convertedLeads;
    private long highLevel;
    private long mediumLevel;
    private long lowLevel;
    private long unqualified;
}
