package com.ai.salesbot.service;

import com.ai.salesbot.entity.CallQuality;
import com.ai.salesbot.entity.ObjectionRecord;
import com.ai.salesbot.entity.SalesAnalytics;
import com.ai.salesbot.entity.SentimentSample;
import com.ai.salesbot.entity.TalkListenRatio;
import com.ai.salesbot.utils.ConversionStage;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Composite 0..100 call score built from four factors worth up to 25 each:
 * talk/listen balance, sentiment trend, funnel stage completion and objection resolution.
 * Stateless; the same signals always give the same score.
 */
@Service
public class CallQualityScorer {

    static final double FACTOR_MAX = 25.0;

    /**
     * Recomputes the talk ratio and the quality breakdown of {@code analytics} in place.
     */
    public CallQuality apply(SalesAnalytics analytics) {
        TalkListenRatio talk = analytics.getTalkListenRatio();
        if (talk == null) {
            talk = new TalkListenRatio();
            analytics.setTalkListenRatio(talk);
        }
        talk.recomputeRatio();
        CallQuality quality = compute(analytics);
        analytics.setCallQuality(quality);
        return quality;
    }

    public CallQuality compute(SalesAnalytics analytics) {
        TalkListenRatio talk = analytics.getTalkListenRatio();
        double talkScore = talk == null
                ? talkListenScore(0, TalkListenRatio.DEFAULT_TARGET)
                : talkListenScore(talk.getRatio(), talk.getTargetRatio());
        double sentimentScore = sentimentTrendScore(analytics.getSentimentHistory());
        double stageScore = stageCompletionScore(analytics.getStageTimings() == null ? 0 : analytics.getStageTimings().size());
        double objectionScore = objectionResolutionScore(analytics.getObjectionsFaced());

        return CallQuality.of(talkScore, sentimentScore, stageScore, objectionScore);
    }

    /** {@code 25 - |ratio - target| * 100}, floored at 0. */
    public double talkListenScore(double ratio, double targetRatio) {
        return Math.max(0, FACTOR_MAX - Math.abs(ratio - targetRatio) * 100);
    }

    /** Neutral 25 below two samples, otherwise {@code 25 + (last - first) * 25} floored at 0. */
    public double sentimentTrendScore(List<SentimentSample> history) {
        if (history == null || history.size() < 2) {
            return FACTOR_MAX;
        }
        double first = history.get(0).getScore();
        double last = history.get(history.size() - 1).getScore();
        return Math.max(0, FACTOR_MAX + (last - first) * FACTOR_MAX);
    }

    public double stageCompletionScore(int recordedStages) {
        return (double) recordedStages / ConversionStage.CANONICAL_FUNNEL_LENGTH * FACTOR_MAX;
    }

    /** Full marks when no objection was raised. */
    public double objectionResolutionScore(List<ObjectionRecord> objections) {
        if (objections == null || objections.isEmpty()) {
            return FACTOR_MAX;
        }
        long resolved = objections.stream().filter(ObjectionRecord::isResolved).count();
        return (double) resolved / objections.size() * FACTOR_MAX;
    }
}
