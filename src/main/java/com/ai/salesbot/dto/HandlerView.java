package com.ai.salesbot.dto;

import com.ai.salesbot.entity.ObjectionHandler;
import com.ai.salesbot.utils.HandlerTechnique;
import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.ObjectionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.TreeSet;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HandlerView {
    private Long id;
    private ObjectionType objectionType;
    private List<String> keywords;
    private String response;
    private HandlerTechnique technique;
    private Language language;
    private List<String> followUpQuestions;
    private int priority;
    private int successRate;
    private int usageCount;

    public static HandlerView from(ObjectionHandler h) {
        return HandlerView.builder()
                .id(h.getId())
                .objectionType(h.getObjectionType())
                .keywords(new ArrayList<>(new TreeSet<>(h.getKeywords())))
                .response(h.getResponse())
                .technique(h.getTechnique())
                .language(h.getLanguage())
                .followUpQuestions(new ArrayList<>(h.getFollowUpQuestions()))
                .priority(h.getPriority())
                .successRate(h.getSuccessRate())
                .usageCount(h.getUsageCount())
                .build();
    }

    public ObjectionHandler toEntity() {
        ObjectionHandler h = ObjectionHandler.builder()
                .objectionType(objectionType)
                .response(response)
                .priority(priority == 0 ? 1 : priority)
                .build();
        if (technique != null) h.setTechnique(technique);
        if (language != null) h.setLanguage(language);
        if (keywords != null) h.setKeywords(new HashSet<>(keywords));
        if (followUpQuestions != null) h.setFollowUpQuestions(new ArrayList<>(followUpQuestions));
        return h;
    }
}
