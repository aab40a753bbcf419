package com.ai.salesbot.entity;

import com.ai.salesbot.utils.QualificationLevel;
import com.ai.salesbot.utils.QualificationStage;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * BANT qualification of the lead on one call. The total score has no setter: it is
 * recomputed from the four dimensions before every insert and update.
 */
@Entity
@Table(name = "lead_qualification", indexes = {
    @Index(name = "idx_lead_qualification_call_id", columnList = "call_id", unique = true),
    @Index(name = "idx_lead_qualification_score", columnList = "qualification_score")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LeadQualification {

    public static final int MAX_TOTAL = 40;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "call_id", nullable = false, unique = true, length = 100)
    private String callId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "score", column = @Column(name = "budget_score", nullable = false)),
        @AttributeOverride(name = "notes", column = @Column(name = "budget_notes", length = 1000))
    })
    @Builder.Default
    private BantDimension budget = new BantDimension();

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "score", column = @Column(name = "authority_score", nullable = false)),
        @AttributeOverride(name = "notes", column = @Column(name = "authority_notes", length = 1000))
    })
    @Builder.Default
    private BantDimension authority = new BantDimension();

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "score", column = @Column(name = "need_score", nullable = false)),
        @AttributeOverride(name = "notes", column = @Column(name = "need_notes", length = 1000))
    })
    @Builder.Default
    private BantDimension need = new BantDimension();

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "score", column = @Column(name = "timeline_score", nullable = false)),
        @AttributeOverride(name = "notes", column = @Column(name = "timeline_notes", length = 1000))
    })
    @Builder.Default
    private BantDimension timeline = new BantDimension();

    @Setter(AccessLevel.NONE)
    @Column(name = "qualification_score", nullable = false)
    @Builder.Default
    private int qualificationScore = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 15)
    @Builder.Default
    private QualificationStage stage = QualificationStage.INITIAL;

    @Column(length = 2000)
    private String notes;

    private Instant createdAt;

    private Instant updatedAt;

    /**
     * Sum of the clamped dimensions, clamped to [0, 40].
     */
    public int recomputeScore() {
        int sum = dimensionScore(budget) + dimensionScore(authority)
                + dimensionScore(need) + dimensionScore(timeline);
        this.qualificationScore = Math.max(0, Math.min(MAX_TOTAL, sum));
        return qualificationScore;
    }

    public QualificationLevel getQualificationLevel() {
        return QualificationLevel.forScore(qualificationScore);
    }

    private static int dimensionScore(BantDimension d) {
        return d == null ? 0 : d.clampedScore();
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
        recomputeScore();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
        recomputeScore();
    }
}
