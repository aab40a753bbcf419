package com.ai.salesbot.entity;

import com.ai.salesbot.utils.HandlerTechnique;
import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.ObjectionType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Canned response to one objection type in one language.
 */
@Entity
@Table(name = "objection_handler", indexes = {
    @Index(name = "idx_objection_handler_lookup", columnList = "objection_type, language, active")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ObjectionHandler {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "objection_type", nullable = false, length = 20)
    private ObjectionType objectionType;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "objection_handler_keyword", joinColumns = @JoinColumn(name = "handler_id"))
    @Column(name = "keyword", length = 100)
    @Builder.Default
    private Set<String> keywords = new HashSet<>();

    @Column(nullable = false, length = 2000)
    private String response;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 25)
    @Builder.Default
    private HandlerTechnique technique = HandlerTechnique.EMPATHY_REFRAME;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private Language language = Language.EN;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "objection_handler_follow_up", joinColumns = @JoinColumn(name = "handler_id"))
    @OrderColumn(name = "position")
    @Column(name = "question", length = 500)
    @Builder.Default
    private List<String> followUpQuestions = new ArrayList<>();

    @Setter(AccessLevel.NONE)
    @Column(name = "success_rate", nullable = false)
    @Builder.Default
    private int successRate = 0;

    @Setter(AccessLevel.NONE)
    @Column(name = "usage_count", nullable = false)
    @Builder.Default
    private int usageCount = 0;

    @Column(nullable = false)
    @Builder.Default
    private int priority = 1;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    private Instant createdAt;

    private Instant updatedAt;

    public void recordUsage(boolean success) {
        usageCount++;
        successRate = SuccessRates.cumulativeMean(successRate, usageCount, success);
    }

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
