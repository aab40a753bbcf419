package com.ai.salesbot.service;

import com.ai.salesbot.dto.AnalyticsView;
import com.ai.salesbot.dto.DateRange;
import com.ai.salesbot.dto.FunnelReport;
import com.ai.salesbot.dto.LiveSnapshot;
import com.ai.salesbot.dto.ObjectionStats;
import com.ai.salesbot.dto.QualityReport;
import com.ai.salesbot.dto.SummaryReport;
import com.ai.salesbot.dto.TalkListenReport;
import com.ai.salesbot.dto.TechniqueStats;
import com.ai.salesbot.entity.CallQuality;
import com.ai.salesbot.entity.CallSession;
import com.ai.salesbot.entity.ObjectionRecord;
import com.ai.salesbot.entity.SalesAnalytics;
import com.ai.salesbot.entity.TalkListenRatio;
import com.ai.salesbot.entity.TechniqueUsage;
import com.ai.salesbot.repository.SalesAnalyticsRepository;
import com.ai.salesbot.utils.ConversionStage;
import com.ai.salesbot.utils.ObjectionType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only aggregates over call analytics for the dashboard.
 */
@Service
public class AnalyticsReportService {

    static final int EXCELLENT_QUALITY = 80;
    static final int GOOD_QUALITY = 60;
    static final double OPTIMAL_RATIO_MIN = 0.3;
    static final double OPTIMAL_RATIO_MAX = 0.5;
    private static final int TOP_N = 5;

    private static final EnumSet<ConversionStage> IN_FLIGHT = EnumSet.of(
            ConversionStage.GREETING, ConversionStage.QUALIFICATION, ConversionStage.PRESENTATION,
            ConversionStage.OBJECTION, ConversionStage.CLOSING);

    private final SalesAnalyticsRepository repository;
    private final CallSessionService callSessionService;
    private final QualificationService qualificationService;
    private final double targetTalkRatio;

    public AnalyticsReportService(SalesAnalyticsRepository repository,
                                  CallSessionService callSessionService,
                                  QualificationService qualificationService,
                                  @Value("${salesbot.analytics.target-talk-ratio:0.4}") double targetTalkRatio) {
        this.repository = repository;
        this.callSessionService = callSessionService;
        this.qualificationService = qualificationService;
        this.targetTalkRatio = targetTalkRatio;
    }

    @Transactional(readOnly = true)
    public FunnelReport funnel(DateRange range) {
        return funnelOf(load(range));
    }

    @Transactional(readOnly = true)
    public List<ObjectionStats> objectionAnalysis(DateRange range) {
        return objectionsOf(load(range));
    }

    @Transactional(readOnly = true)
    public List<TechniqueStats> techniquePerformance(DateRange range) {
        return techniquesOf(load(range));
    }

    @Transactional(readOnly = true)
    public QualityReport callQuality(DateRange range) {
        return qualityOf(load(range));
    }

    @Transactional(readOnly = true)
    public TalkListenReport talkListen(DateRange range) {
        return talkListenOf(load(range));
    }

    /**
     * Calls in flight right now plus the latest analytics of calls still mid-funnel.
     */
    @Transactional
    public LiveSnapshot live() {
        List<CallSession> active = callSessionService.listActive();
        List<AnalyticsView> recent = repository.findTop10ByConversionStageInOrderByCreatedAtDesc(IN_FLIGHT).stream()
                .map(AnalyticsView::from)
                .collect(Collectors.toList());
        return LiveSnapshot.builder()
                .activeCount(active.size())
                .activeCalls(active)
                .recentActivity(recent)
                .generatedAt(Instant.now())
                .build();
    }

    @Transactional(readOnly = true)
    public SummaryReport summary(DateRange range) {
        List<SalesAnalytics> records = load(range);
        List<ObjectionStats> objections = objectionsOf(records);
        List<TechniqueStats> techniques = techniquesOf(records);
        return SummaryReport.builder()
                .calls(callSessionService.stats(range))
                .funnel(funnelOf(records))
                .qualification(qualificationService.stats(range))
                .quality(qualityOf(records))
                .talkListen(talkListenOf(records))
                .topObjections(objections.subList(0, Math.min(TOP_N, objections.size())))
                .topTechniques(techniques.subList(0, Math.min(TOP_N, techniques.size())))
                .build();
    }

    private List<SalesAnalytics> load(DateRange range) {
        DateRange r = range != null ? range : DateRange.all();
        return repository.findByCreatedAtBetween(r.getFrom(), r.getTo());
    }

    FunnelReport funnelOf(List<SalesAnalytics> records) {
        Map<ConversionStage, Long> counts = new EnumMap<>(ConversionStage.class);
        for (SalesAnalytics a : records) {
            counts.merge(a.getConversionStage(), 1L, Long::sum);
        }
        long total = records.size();
        List<FunnelReport.StageCount> stages = new ArrayList<>();
        for (ConversionStage stage : ConversionStage.values()) {
            long count = counts.getOrDefault(stage, 0L);
            stages.add(new FunnelReport.StageCount(stage, count, percent(count, total)));
        }
        return FunnelReport.builder()
                .totalCalls(total)
                .stages(stages)
                .conversionRate(percent(counts.getOrDefault(ConversionStage.CONVERTED, 0L), total))
                .build();
    }

    List<ObjectionStats> objectionsOf(List<SalesAnalytics> records) {
        Map<ObjectionType, long[]> acc = new EnumMap<>(ObjectionType.class);
        for (SalesAnalytics a : records) {
            for (ObjectionRecord o : a.getObjectionsFaced()) {
                // count, resolved, total resolution seconds
                long[] v = acc.computeIfAbsent(o.getObjectionType(), k -> new long[3]);
                v[0]++;
                if (o.isResolved()) {
                    v[1]++;
                    v[2] += o.getResolutionTime() != null ? o.getResolutionTime() : 0L;
                }
            }
        }
        return acc.entrySet().stream()
                .map(e -> ObjectionStats.builder()
                        .objectionType(e.getKey())
                        .count(e.getValue()[0])
                        .resolved(e.getValue()[1])
                        .resolutionRate(percent(e.getValue()[1], e.getValue()[0]))
                        .averageResolutionTime(e.getValue()[1] == 0 ? 0 : round1((double) e.getValue()[2] / e.getValue()[1]))
                        .build())
                .sorted(Comparator.comparingLong(ObjectionStats::getCount).reversed())
                .collect(Collectors.toList());
    }

    List<TechniqueStats> techniquesOf(List<SalesAnalytics> records) {
        Map<String, long[]> acc = new LinkedHashMap<>();
        for (SalesAnalytics a : records) {
            for (TechniqueUsage t : a.getTechniquesUsed()) {
                long[] v = acc.computeIfAbsent(t.getTechnique(), k -> new long[2]);
                v[0]++;
                if (t.isSuccess()) v[1]++;
            }
        }
        return acc.entrySet().stream()
                .map(e -> TechniqueStats.builder()
                        .technique(e.getKey())
                        .usageCount(e.getValue()[0])
                        .successCount(e.getValue()[1])
                        .successRate(percent(e.getValue()[1], e.getValue()[0]))
                        .build())
                .sorted(Comparator.comparingDouble(TechniqueStats::getSuccessRate).reversed()
                        .thenComparing(Comparator.comparingLong(TechniqueStats::getUsageCount).reversed()))
                .collect(Collectors.toList());
    }

    QualityReport qualityOf(List<SalesAnalytics> records) {
        long excellent = 0, good = 0, poor = 0;
        double score = 0, talk = 0, sentiment = 0, stage = 0, objection = 0;
        for (SalesAnalytics a : records) {
            CallQuality q = a.getCallQuality();
            if (q == null) q = new CallQuality();
            if (q.getScore() >= EXCELLENT_QUALITY) excellent++;
            else if (q.getScore() >= GOOD_QUALITY) good++;
            else poor++;
            score += q.getScore();
            talk += q.getTalkListenRatio();
            sentiment += q.getSentimentTrend();
            stage += q.getStageCompletion();
            objection += q.getObjectionResolution();
        }
        int n = records.size();
        return QualityReport.builder()
                .totalCalls(n)
                .averageScore(avg(score, n))
                .excellent(excellent)
                .good(good)
                .needsImprovement(poor)
                .averageTalkListen(avg(talk, n))
                .averageSentimentTrend(avg(sentiment, n))
                .averageStageCompletion(avg(stage, n))
                .averageObjectionResolution(avg(objection, n))
                .build();
    }

    TalkListenReport talkListenOf(List<SalesAnalytics> records) {
        double ratio = 0, ai = 0, user = 0;
        long optimal = 0;
        for (SalesAnalytics a : records) {
            TalkListenRatio t = a.getTalkListenRatio();
            if (t == null) continue;
            ratio += t.getRatio();
            ai += t.getAiTalkTime();
            user += t.getUserTalkTime();
            if (t.getRatio() >= OPTIMAL_RATIO_MIN && t.getRatio() <= OPTIMAL_RATIO_MAX) optimal++;
        }
        int n = records.size();
        return TalkListenReport.builder()
                .totalCalls(n)
                .averageRatio(n == 0 ? 0 : Math.round(ratio / n * 1000) / 1000.0)
                .targetRatio(targetTalkRatio)
                .optimalCalls(optimal)
                .optimalPercentage(percent(optimal, n))
                .averageAiTalkTime(avg(ai, n))
                .averageUserTalkTime(avg(user, n))
                .build();
    }

    private static double percent(long part, long total) {
        return total == 0 ? 0 : round1(part * 100.0 / total);
    }

    private static double avg(double sum, int n) {
        return n == 0 ? 0 : round1(sum / n);
    }

    private static double round1(double v) {
        return Math.round(v * 10) / 10.0;
    }
}
