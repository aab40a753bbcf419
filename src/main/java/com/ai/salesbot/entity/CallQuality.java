package com.ai.salesbot.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * Composite 0..100 call score and the four 0..25 factors it was built from.
 * The composite is derived from the factors in {@link #of} and cannot be set on its own.
 */
@Embeddable
@Getter
@NoArgsConstructor
public class CallQuality {

    @Column(name = "quality_score", nullable = false)
    private int score;

    @Column(name = "factor_talk_listen", nullable = false)
    private double talkListenRatio;

    @Column(name = "factor_sentiment_trend", nullable = false)
    private double sentimentTrend;

    @Column(name = "factor_stage_completion", nullable = false)
    private double stageCompletion;

    @Column(name = "factor_objection_resolution", nullable = false)
    private double objectionResolution;

    /**
     * Sum of the factors, rounded and clamped to [0, 100].
     */
    public static CallQuality of(double talkListenRatio, double sentimentTrend,
                                 double stageCompletion, double objectionResolution) {
        CallQuality q = new CallQuality();
        q.talkListenRatio = talkListenRatio;
        q.sentimentTrend = sentimentTrend;
        q.stageCompletion = stageCompletion;
        q.objectionResolution = objectionResolution;
        double sum = talkListenRatio + sentimentTrend + stageCompletion + objectionResolution;
        q.score = (int) Math.round(Math.max(0, Math.min(100, sum)));
        return q;
    }
}
