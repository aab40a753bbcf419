package com.ai.salesbot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummaryReport {
    private CallStats calls;
    private FunnelReport funnel;
    private QualificationStats qualification;
    private QualityReport quality;
    private TalkListenReport talkListen;
    private List<ObjectionStats> topObjections;
    private List<TechniqueStats> topTechniques;
}
