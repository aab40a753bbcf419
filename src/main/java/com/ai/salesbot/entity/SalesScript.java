package com.ai.salesbot.entity;

import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.ObjectionType;
import com.ai.salesbot.utils.SalesMethod;
import com.ai.salesbot.utils.ScriptStage;
import com.ai.salesbot.utils.ScriptType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Entity
@Table(name = "sales_script", indexes = {
    @Index(name = "idx_sales_script_product_type", columnList = "product_id, script_type, active"),
    @Index(name = "idx_sales_script_ranking", columnList = "priority, success_rate")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SalesScript {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Enumerated(EnumType.STRING)
    @Column(name = "script_type", nullable = false, length = 15)
    private ScriptType scriptType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 15)
    @Builder.Default
    private SalesMethod technique = SalesMethod.GENERIC;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 15)
    @Builder.Default
    private ScriptStage stage = ScriptStage.PRESENTATION;

    /** Raw template; placeholders are filled in by the voice engine, never here. */
    @Column(nullable = false, length = 4000)
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private Language language = Language.EN;

    @Column(nullable = false)
    @Builder.Default
    private int priority = 1;

    @Embedded
    @Builder.Default
    private ScriptConditions conditions = new ScriptConditions();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "sales_script_trigger", joinColumns = @JoinColumn(name = "script_id"))
    @Column(name = "keyword", length = 100)
    @Builder.Default
    private Set<String> triggers = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "sales_script_required_objection", joinColumns = @JoinColumn(name = "script_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "objection_type", length = 20)
    @Builder.Default
    private Set<ObjectionType> requiredObjections = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "sales_script_variable", joinColumns = @JoinColumn(name = "script_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<ScriptVariable> variables = new ArrayList<>();

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
    private boolean active = true;

    private Instant createdAt;

    private Instant updatedAt;

    /**
     * Counts one more use and folds its outcome into the success rate.
     */
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
