package com.ai.salesbot.dto;

import com.ai.salesbot.entity.CallQuality;
import com.ai.salesbot.entity.KeyPhrase;
import com.ai.salesbot.entity.ObjectionRecord;
import com.ai.salesbot.entity.SalesAnalytics;
import com.ai.salesbot.entity.SentimentSample;
import com.ai.salesbot.entity.StageTiming;
import com.ai.salesbot.entity.TalkListenRatio;
import com.ai.salesbot.entity.TechniqueUsage;
import com.ai.salesbot.utils.ConversionStage;
import com.ai.salesbot.utils.OutcomeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Detached copy of a {@link SalesAnalytics} record, safe to serialize outside a transaction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsView {
    private String callId;
    private ConversionStage conversionStage;
    private OutcomeType outcomeType;
    private List<ObjectionRecord> objectionsFaced;
    private List<TechniqueUsage> techniquesUsed;
    private List<SentimentSample> sentimentHistory;
    private double sentimentScore;
    private TalkListenRatio talkListenRatio;
    private List<KeyPhrase> keyPhrases;
    private CallQuality callQuality;
    private long duration;
    private List<StageTiming> stageTimings;
    private Instant createdAt;

    public static AnalyticsView from(SalesAnalytics a) {
        return AnalyticsView.builder()
                .callId(a.getCallId())
                .conversionStage(a.getConversionStage())
                .outcomeType(a.getOutcomeType())
                .objectionsFaced(new ArrayList<>(a.getObjectionsFaced()))
                .techniquesUsed(new ArrayList<>(a.getTechniquesUsed()))
                .sentimentHistory(new ArrayList<>(a.getSentimentHistory()))
                .sentimentScore(a.getSentimentScore())
                .talkListenRatio(a.getTalkListenRatio())
                .keyPhrases(new ArrayList<>(a.getKeyPhrases()))
                .callQuality(a.getCallQuality())
                .duration(a.getDuration())
                .stageTimings(new ArrayList<>(a.getStageTimings()))
                .createdAt(a.getCreatedAt())
                .build();
    }
}
