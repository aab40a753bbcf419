package com.ai.salesbot.service;

import com.ai.salesbot.entity.CallQuality;
import com.ai.salesbot.entity.ObjectionRecord;
import com.ai.salesbot.entity.SalesAnalytics;
import com.ai.salesbot.entity.SentimentSample;
import com.ai.salesbot.entity.StageTiming;
import com.ai.salesbot.entity.TalkListenRatio;
import com.ai.salesbot.utils.ConversionStage;
import com.ai.salesbot.utils.ObjectionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("CallQualityScorer")
class CallQualityScorerTest {

    private final CallQualityScorer scorer = new CallQualityScorer();

    @Nested
    @DisplayName("talk/listen factor")
    class TalkListen {

        @Test
        @DisplayName("ratio on target earns full marks")
        void onTarget() {
            assertThat(scorer.talkListenScore(0.4, 0.4)).isEqualTo(25.0);
        }

        @Test
        @DisplayName("each point of deviation costs one point")
        void deviation() {
            assertThat(scorer.talkListenScore(0.6, 0.4)).isCloseTo(5.0, within(1e-9));
            assertThat(scorer.talkListenScore(0.2, 0.4)).isCloseTo(5.0, within(1e-9));
        }

        @Test
        @DisplayName("never negative")
        void floored() {
            assertThat(scorer.talkListenScore(1.0, 0.4)).isZero();
        }
    }

    @Nested
    @DisplayName("sentiment trend factor")
    class SentimentTrend {

        @Test
        @DisplayName("fewer than two samples is neutral")
        void neutral() {
            assertThat(scorer.sentimentTrendScore(List.of())).isEqualTo(25.0);
            assertThat(scorer.sentimentTrendScore(List.of(sample(0.8)))).isEqualTo(25.0);
        }

        @Test
        @DisplayName("uses first and last sample only")
        void firstAndLast() {
            assertThat(scorer.sentimentTrendScore(List.of(sample(0.0), sample(-1.0), sample(0.5))))
                    .isCloseTo(37.5, within(1e-9));
        }

        @Test
        @DisplayName("a falling trend is floored at zero")
        void falling() {
            assertThat(scorer.sentimentTrendScore(List.of(sample(1.0), sample(-1.0)))).isZero();
        }
    }

    @Test
    @DisplayName("stage completion is a share of the six canonical stages")
    void stageCompletion() {
        assertThat(scorer.stageCompletionScore(0)).isZero();
        assertThat(scorer.stageCompletionScore(3)).isCloseTo(12.5, within(1e-9));
        assertThat(scorer.stageCompletionScore(6)).isCloseTo(25.0, within(1e-9));
    }

    @Test
    @DisplayName("no objections earns full objection marks, otherwise the resolved share")
    void objectionResolution() {
        assertThat(scorer.objectionResolutionScore(List.of())).isEqualTo(25.0);
        assertThat(scorer.objectionResolutionScore(List.of(objection(true), objection(false))))
                .isCloseTo(12.5, within(1e-9));
    }

    @Nested
    @DisplayName("composite")
    class Composite {

        @Test
        @DisplayName("empty analytics scores talk 0, sentiment 25, stages 0, objections 25")
        void emptyAnalytics() {
            CallQuality quality = scorer.apply(SalesAnalytics.builder().build());

            assertThat(quality.getTalkListenRatio()).isZero();
            assertThat(quality.getSentimentTrend()).isEqualTo(25.0);
            assertThat(quality.getStageCompletion()).isZero();
            assertThat(quality.getObjectionResolution()).isEqualTo(25.0);
            assertThat(quality.getScore()).isEqualTo(50);
        }

        @Test
        @DisplayName("apply recomputes the ratio before scoring")
        void recomputesRatio() {
            SalesAnalytics analytics = SalesAnalytics.builder().build();
            analytics.setTalkListenRatio(TalkListenRatio.builder().aiTalkTime(40).userTalkTime(60).build());

            CallQuality quality = scorer.apply(analytics);

            assertThat(analytics.getTalkListenRatio().getRatio()).isCloseTo(0.4, within(1e-9));
            assertThat(quality.getScore()).isEqualTo(75);
            assertThat(analytics.getCallQuality()).isSameAs(quality);
        }

        @Test
        @DisplayName("composite is clamped to 100")
        void clamped() {
            SalesAnalytics analytics = SalesAnalytics.builder().build();
            analytics.setTalkListenRatio(TalkListenRatio.builder().aiTalkTime(4).userTalkTime(6).build());
            analytics.setSentimentHistory(new ArrayList<>(List.of(sample(-1.0), sample(1.0))));
            List<StageTiming> timings = new ArrayList<>();
            for (int i = 0; i < ConversionStage.CANONICAL_FUNNEL_LENGTH; i++) {
                timings.add(StageTiming.builder().stage(ConversionStage.values()[i]).startTime(Instant.now()).build());
            }
            analytics.setStageTimings(timings);

            assertThat(scorer.apply(analytics).getScore()).isEqualTo(100);
        }

        @Test
        @DisplayName("same signals always give the same score")
        void deterministic() {
            SalesAnalytics analytics = SalesAnalytics.builder().build();
            analytics.setTalkListenRatio(TalkListenRatio.builder().aiTalkTime(30).userTalkTime(50).build());
            analytics.setSentimentHistory(new ArrayList<>(List.of(sample(-0.2), sample(0.3))));
            analytics.setObjectionsFaced(new ArrayList<>(List.of(objection(true), objection(false), objection(false))));

            assertThat(scorer.compute(analytics).getScore()).isEqualTo(scorer.compute(analytics).getScore());
        }
    }

    @Test
    @DisplayName("the composite is always the rounded, clamped sum of its factors")
    void compositeDerivedFromFactors() {
        assertThat(CallQuality.of(10.2, 10.2, 0, 0).getScore()).isEqualTo(20);
        assertThat(CallQuality.of(30, 30, 30, 30).getScore()).isEqualTo(100);
        assertThat(CallQuality.of(-5, 0, 0, 0).getScore()).isZero();
        assertThat(new CallQuality().getScore()).isZero();
    }

    private static SentimentSample sample(double score) {
        return SentimentSample.builder().timestamp(Instant.now()).score(score).build();
    }

    private static ObjectionRecord objection(boolean resolved) {
        return ObjectionRecord.builder()
                .objectionType(ObjectionType.PRICE)
                .timestamp(Instant.now())
                .resolved(resolved)
                .build();
    }
}
