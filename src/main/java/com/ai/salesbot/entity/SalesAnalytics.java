package com.ai.salesbot.entity;

import com.ai.salesbot.utils.ConversionStage;
import com.ai.salesbot.utils.OutcomeType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-call sales signals. Derived fields (talk ratio, call quality) are refreshed by
 * {@code SalesAnalyticsService} before every save.
 */
@Entity
@Table(name = "sales_analytics", indexes = {
    @Index(name = "idx_sales_analytics_call_id", columnList = "call_id", unique = true),
    @Index(name = "idx_sales_analytics_stage", columnList = "conversion_stage, created_at"),
    @Index(name = "idx_sales_analytics_outcome", columnList = "outcome_type, created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SalesAnalytics {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "call_id", nullable = false, unique = true, length = 100)
    private String callId;

    @Enumerated(EnumType.STRING)
    @Column(name = "conversion_stage", nullable = false, length = 15)
    @Builder.Default
    private ConversionStage conversionStage = ConversionStage.GREETING;

    @ElementCollection
    @CollectionTable(name = "sales_analytics_objection", joinColumns = @JoinColumn(name = "analytics_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<ObjectionRecord> objectionsFaced = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "sales_analytics_technique", joinColumns = @JoinColumn(name = "analytics_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<TechniqueUsage> techniquesUsed = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "sales_analytics_sentiment", joinColumns = @JoinColumn(name = "analytics_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<SentimentSample> sentimentHistory = new ArrayList<>();

    /** Most recent sentiment sample, 0 when none. */
    @Column(name = "sentiment_score", nullable = false)
    @Builder.Default
    private double sentimentScore = 0;

    @Embedded
    @Builder.Default
    private TalkListenRatio talkListenRatio = new TalkListenRatio();

    @ElementCollection
    @CollectionTable(name = "sales_analytics_key_phrase", joinColumns = @JoinColumn(name = "analytics_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<KeyPhrase> keyPhrases = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome_type", length = 25)
    private OutcomeType outcomeType;

    @Embedded
    @Builder.Default
    private CallQuality callQuality = new CallQuality();

    /** Call duration in seconds, copied from the call session when it ends. */
    @Column(nullable = false)
    @Builder.Default
    private long duration = 0L;

    @ElementCollection
    @CollectionTable(name = "sales_analytics_stage_timing", joinColumns = @JoinColumn(name = "analytics_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<StageTiming> stageTimings = new ArrayList<>();

    @Column(name = "created_at")
    private Instant createdAt;

    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
