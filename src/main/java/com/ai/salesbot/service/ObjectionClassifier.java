package com.ai.salesbot.service;

import com.ai.salesbot.dto.ObjectionDetection;
import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.ObjectionType;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Multi-label objection detector. Every category whose vocabulary appears in the utterance
 * (case-insensitive substring) is reported; there is no ranking and no confidence.
 * Vocabularies mix English with romanized Hindi so one pass covers all language tags.
 */
@Service
public class ObjectionClassifier {

    private static final Map<ObjectionType, List<String>> KEYWORDS = new EnumMap<>(ObjectionType.class);

    static {
        KEYWORDS.put(ObjectionType.PRICE, List.of(
                "expensive", "cost", "price", "budget", "cheap", "afford", "costly",
                "mahanga", "mehenga", "paisa", "paise", "kimat", "keemat"));
        KEYWORDS.put(ObjectionType.TIMING, List.of(
                "later", "think", "decide", "busy", "time", "next month", "next week",
                "baad mein", "soch", "abhi nahi", "fursat"));
        KEYWORDS.put(ObjectionType.COMPETITION, List.of(
                "already have", "other company", "competitor", "alternative", "different",
                "another provider", "using someone", "pehle se", "dusra", "dusri company"));
        KEYWORDS.put(ObjectionType.TRUST, List.of(
                "trust", "believe", "sure", "confident", "reliable", "scam", "fraud", "guarantee",
                "bharosa", "yakeen", "vishwas"));
        KEYWORDS.put(ObjectionType.AUTHORITY, List.of(
                "boss", "manager", "decision", "approve", "permission", "my wife", "my husband", "partner",
                "family se", "ghar wale", "puchna padega"));
        KEYWORDS.put(ObjectionType.NEED, List.of(
                "need", "want", "require", "necessary", "important", "useful",
                "zaroorat", "zarurat", "chahiye", "kaam ka nahi"));
        KEYWORDS.put(ObjectionType.BUDGET, List.of(
                "budget", "money", "funds", "financial", "paisa", "can't afford", "cannot afford",
                "paise nahi"));
        KEYWORDS.put(ObjectionType.URGENCY, List.of(
                "urgent", "immediate", "quick", "fast", "jaldi",
                "no rush", "no hurry", "whenever", "aaram se"));
        KEYWORDS.put(ObjectionType.OTHER, List.of(
                "not interested", "no thanks", "no thank you", "remove my number", "don't call",
                "dilchaspi nahi", "interest nahi", "mat karo call"));
    }

    public ObjectionDetection detect(String utterance, Language language) {
        Language lang = language != null ? language : Language.EN;
        if (StringUtils.isBlank(utterance)) {
            return ObjectionDetection.none(utterance, lang);
        }
        return new ObjectionDetection(classify(utterance), utterance, lang);
    }

    /**
     * All matching categories; empty when nothing matches.
     */
    public Set<ObjectionType> classify(String utterance) {
        if (StringUtils.isBlank(utterance)) return Collections.emptySet();
        String text = utterance.toLowerCase();
        Set<ObjectionType> matched = EnumSet.noneOf(ObjectionType.class);
        for (Map.Entry<ObjectionType, List<String>> e : KEYWORDS.entrySet()) {
            for (String keyword : e.getValue()) {
                if (text.contains(keyword)) {
                    matched.add(e.getKey());
                    break;
                }
            }
        }
        return matched;
    }
}
