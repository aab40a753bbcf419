package com.ai.salesbot.service;

import com.ai.salesbot.dto.AnalyticsView;
import com.ai.salesbot.dto.CallEndedEvent;
import com.ai.salesbot.dto.DashboardEvent;
import com.ai.salesbot.entity.CallQuality;
import com.ai.salesbot.entity.CallSession;
import com.ai.salesbot.entity.KeyPhrase;
import com.ai.salesbot.entity.ObjectionRecord;
import com.ai.salesbot.entity.SalesAnalytics;
import com.ai.salesbot.entity.SentimentSample;
import com.ai.salesbot.entity.StageTiming;
import com.ai.salesbot.entity.TalkListenRatio;
import com.ai.salesbot.entity.TechniqueUsage;
import com.ai.salesbot.exception.NotFoundException;
import com.ai.salesbot.exception.ValidationException;
import com.ai.salesbot.repository.CallSessionRepository;
import com.ai.salesbot.repository.SalesAnalyticsRepository;
import com.ai.salesbot.utils.ConversionStage;
import com.ai.salesbot.utils.ObjectionType;
import com.ai.salesbot.utils.OutcomeType;
import com.ai.salesbot.websocket.EventBroadcaster;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records the sales signals of a call. Every save goes through {@link #persist} so the talk
 * ratio and call quality stored with a record always match its signals.
 */
@Service
public class SalesAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(SalesAnalyticsService.class);

    private static final int MAX_SAMPLE_TEXT = 500;
    private static final int MAX_CONTEXT = 500;

    private final SalesAnalyticsRepository repository;
    private final CallSessionRepository callRepository;
    private final CallQualityScorer scorer;
    private final EventBroadcaster broadcaster;
    private final double targetTalkRatio;

    public SalesAnalyticsService(SalesAnalyticsRepository repository,
                                 CallSessionRepository callRepository,
                                 CallQualityScorer scorer,
                                 EventBroadcaster broadcaster,
                                 @Value("${salesbot.analytics.target-talk-ratio:0.4}") double targetTalkRatio) {
        this.repository = repository;
        this.callRepository = callRepository;
        this.scorer = scorer;
        this.broadcaster = broadcaster;
        this.targetTalkRatio = targetTalkRatio;
    }

    @Transactional(readOnly = true)
    public AnalyticsView get(String callId) {
        return repository.findByCallId(callId)
                .map(AnalyticsView::from)
                .orElseThrow(() -> NotFoundException.of("Analytics", callId));
    }

    @Transactional
    public AnalyticsView recordObjection(String callId, ObjectionType type) {
        if (type == null) throw new ValidationException("objectionType is required");
        return recordObjections(callId, List.of(type));
    }

    @Transactional
    public AnalyticsView recordObjections(String callId, Collection<ObjectionType> types) {
        SalesAnalytics a = getOrCreate(callId);
        Instant now = Instant.now();
        for (ObjectionType type : types) {
            a.getObjectionsFaced().add(ObjectionRecord.builder()
                    .objectionType(type)
                    .timestamp(now)
                    .resolved(false)
                    .build());
        }
        if (!types.isEmpty() && a.getConversionStage() != ConversionStage.OBJECTION) {
            moveToStage(a, ConversionStage.OBJECTION, now);
        }
        return persist(a);
    }

    /**
     * Marks the objection at {@code index} resolved. Resolving twice keeps the first resolution.
     */
    @Transactional
    public AnalyticsView resolveObjection(String callId, int index, String technique) {
        SalesAnalytics a = getOrCreate(callId);
        List<ObjectionRecord> objections = a.getObjectionsFaced();
        if (index < 0 || index >= objections.size()) {
            throw new ValidationException("No objection at index " + index);
        }
        ObjectionRecord record = objections.get(index);
        if (record.isResolved()) {
            return AnalyticsView.from(a);
        }
        record.setResolved(true);
        record.setResolutionTime(CallSession.secondsBetween(record.getTimestamp(), Instant.now()));
        record.setTechniqueUsed(technique);
        return persist(a);
    }

    @Transactional
    public AnalyticsView recordTechnique(String callId, String technique, String stage, boolean success) {
        if (StringUtils.isBlank(technique)) throw new ValidationException("technique is required");
        SalesAnalytics a = getOrCreate(callId);
        a.getTechniquesUsed().add(TechniqueUsage.builder()
                .technique(technique)
                .stage(stage)
                .timestamp(Instant.now())
                .success(success)
                .build());
        return persist(a);
    }

    @Transactional
    public AnalyticsView recordSentiment(String callId, double score, String text) {
        checkSentiment(score);
        SalesAnalytics a = getOrCreate(callId);
        a.getSentimentHistory().add(SentimentSample.builder()
                .timestamp(Instant.now())
                .score(score)
                .text(StringUtils.abbreviate(text, MAX_SAMPLE_TEXT))
                .build());
        a.setSentimentScore(score);
        return persist(a);
    }

    /**
     * Rewrites a past sentiment sample. The quality score follows the corrected history.
     */
    @Transactional
    public AnalyticsView correctSentimentSample(String callId, int index, double score) {
        checkSentiment(score);
        SalesAnalytics a = getOrCreate(callId);
        List<SentimentSample> history = a.getSentimentHistory();
        if (index < 0 || index >= history.size()) {
            throw new ValidationException("No sentiment sample at index " + index);
        }
        history.get(index).setScore(score);
        a.setSentimentScore(history.get(history.size() - 1).getScore());
        return persist(a);
    }

    /**
     * Adds talk time in seconds for each side.
     */
    @Transactional
    public AnalyticsView recordTalkTime(String callId, double aiSeconds, double userSeconds) {
        if (aiSeconds < 0 || userSeconds < 0) {
            throw new ValidationException("Talk time must not be negative");
        }
        SalesAnalytics a = getOrCreate(callId);
        TalkListenRatio talk = a.getTalkListenRatio();
        talk.setAiTalkTime(talk.getAiTalkTime() + aiSeconds);
        talk.setUserTalkTime(talk.getUserTalkTime() + userSeconds);
        return persist(a);
    }

    @Transactional
    public AnalyticsView recordKeyPhrase(String callId, String phrase, String category, String context) {
        if (StringUtils.isBlank(phrase)) throw new ValidationException("phrase is required");
        SalesAnalytics a = getOrCreate(callId);
        addKeyPhrase(a, phrase, category, context, Instant.now());
        return persist(a);
    }

    @Transactional
    public AnalyticsView recordKeyPhrases(String callId, Map<String, String> phraseToCategory, String context) {
        SalesAnalytics a = getOrCreate(callId);
        Instant now = Instant.now();
        phraseToCategory.forEach((phrase, category) -> addKeyPhrase(a, phrase, category, context, now));
        return persist(a);
    }

    /**
     * Closes the open stage timing and opens one for {@code stage}. Re-entering the current stage is a no-op.
     */
    @Transactional
    public AnalyticsView advanceStage(String callId, ConversionStage stage) {
        if (stage == null) throw new ValidationException("stage is required");
        SalesAnalytics a = getOrCreate(callId);
        if (a.getConversionStage() == stage && hasOpenTiming(a)) {
            return AnalyticsView.from(a);
        }
        moveToStage(a, stage, Instant.now());
        return persist(a);
    }

    @Transactional
    public AnalyticsView setOutcome(String callId, OutcomeType outcome) {
        if (outcome == null) throw new ValidationException("outcome is required");
        SalesAnalytics a = getOrCreate(callId);
        a.setOutcomeType(outcome);
        return persist(a);
    }

    /**
     * Copies the final duration, closes the running stage and rescores. Calls that never
     * produced analytics are left alone.
     */
    @EventListener
    @Transactional
    public void onCallEnded(CallEndedEvent event) {
        repository.findByCallId(event.getCallId()).ifPresent(a -> {
            a.setDuration(event.getDuration());
            closeOpenTiming(a, event.getEndTime() != null ? event.getEndTime() : Instant.now());
            persist(a);
            log.debug("Analytics finalized | callId={} quality={}", a.getCallId(), a.getCallQuality().getScore());
        });
    }

    private SalesAnalytics getOrCreate(String callId) {
        if (StringUtils.isBlank(callId)) throw new ValidationException("callId is required");
        return repository.findByCallId(callId).orElseGet(() -> {
            if (callRepository.findByCallId(callId).isEmpty()) {
                throw NotFoundException.of("Call", callId);
            }
            TalkListenRatio talk = new TalkListenRatio();
            talk.setTargetRatio(targetTalkRatio);
            return SalesAnalytics.builder()
                    .callId(callId)
                    .talkListenRatio(talk)
                    .build();
        });
    }

    private AnalyticsView persist(SalesAnalytics a) {
        CallQuality quality = scorer.apply(a);
        SalesAnalytics saved = repository.save(a);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("conversionStage", saved.getConversionStage());
        data.put("sentimentScore", saved.getSentimentScore());
        data.put("talkListenRatio", saved.getTalkListenRatio().getRatio());
        data.put("callQuality", quality);
        broadcaster.publish(DashboardEvent.ANALYTICS_UPDATED, saved.getCallId(), data);
        return AnalyticsView.from(saved);
    }

    private void moveToStage(SalesAnalytics a, ConversionStage stage, Instant now) {
        closeOpenTiming(a, now);
        a.getStageTimings().add(StageTiming.builder().stage(stage).startTime(now).build());
        a.setConversionStage(stage);
    }

    private static void closeOpenTiming(SalesAnalytics a, Instant at) {
        for (StageTiming t : a.getStageTimings()) {
            if (t.isOpen()) {
                t.setEndTime(at);
                t.setDuration(CallSession.secondsBetween(t.getStartTime(), at));
            }
        }
    }

    private static boolean hasOpenTiming(SalesAnalytics a) {
        return a.getStageTimings().stream().anyMatch(StageTiming::isOpen);
    }

    private static void addKeyPhrase(SalesAnalytics a, String phrase, String category, String context, Instant at) {
        a.getKeyPhrases().add(KeyPhrase.builder()
                .phrase(phrase)
                .category(category)
                .timestamp(at)
                .context(StringUtils.abbreviate(context, MAX_CONTEXT))
                .build());
    }

    private static void checkSentiment(double score) {
        if (Double.isNaN(score) || score < -1 || score > 1) {
            throw new ValidationException("Sentiment score must be between -1 and 1");
        }
    }
}
