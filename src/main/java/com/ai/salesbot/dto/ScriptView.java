package com.ai.salesbot.dto;

import com.ai.salesbot.entity.SalesScript;
import com.ai.salesbot.entity.ScriptConditions;
import com.ai.salesbot.entity.ScriptVariable;
import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.ObjectionType;
import com.ai.salesbot.utils.SalesMethod;
import com.ai.salesbot.utils.ScriptStage;
import com.ai.salesbot.utils.ScriptType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Script as handed to callers: raw template plus its variable manifest.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScriptView {
    private Long id;
    private Long productId;
    private ScriptType scriptType;
    private SalesMethod technique;
    private ScriptStage stage;
    private Language language;
    private String content;
    private List<ScriptVariable> variables;
    private int priority;
    private Integer minQualificationScore;
    private Long maxCallDuration;
    private Set<String> triggers;
    private Set<ObjectionType> requiredObjections;
    private int successRate;
    private int usageCount;
    private boolean active;

    public static ScriptView from(SalesScript s) {
        ScriptConditions c = s.getConditions();
        return ScriptView.builder()
                .id(s.getId())
                .productId(s.getProductId())
                .scriptType(s.getScriptType())
                .technique(s.getTechnique())
                .stage(s.getStage())
                .language(s.getLanguage())
                .content(s.getContent())
                .variables(new ArrayList<>(s.getVariables()))
                .priority(s.getPriority())
                .minQualificationScore(c != null ? c.getMinQualificationScore() : null)
                .maxCallDuration(c != null ? c.getMaxCallDuration() : null)
                .triggers(new HashSet<>(s.getTriggers()))
                .requiredObjections(new HashSet<>(s.getRequiredObjections()))
                .successRate(s.getSuccessRate())
                .usageCount(s.getUsageCount())
                .active(s.isActive())
                .build();
    }

    /**
     * New script from this view. Usage statistics are not copied; they start from zero.
     */
    public SalesScript toEntity() {
        SalesScript s = SalesScript.builder()
                .productId(productId)
                .scriptType(scriptType)
                .content(content)
                .priority(priority == 0 ? 1 : priority)
                .conditions(new ScriptConditions(minQualificationScore, maxCallDuration))
                .active(true)
                .build();
        if (technique != null) s.setTechnique(technique);
        if (stage != null) s.setStage(stage);
        if (language != null) s.setLanguage(language);
        if (variables != null) s.setVariables(new ArrayList<>(variables));
        if (triggers != null) s.setTriggers(new HashSet<>(triggers));
        if (requiredObjections != null) s.setRequiredObjections(new HashSet<>(requiredObjections));
        return s;
    }
}
