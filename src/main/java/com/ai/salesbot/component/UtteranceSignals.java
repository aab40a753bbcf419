package com.ai.salesbot.component;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword heuristics over a single utterance: coarse sentiment and sales key phrases.
 */
@Component
public class UtteranceSignals {

    public static final double POSITIVE = 0.5;
    public static final double NEGATIVE = -0.5;

    private static final List<String> POSITIVE_WORDS = List.of(
            "good", "great", "excellent", "amazing", "perfect", "love", "wonderful", "nice", "awesome",
            "achha", "accha", "badhiya", "shandaar");

    private static final List<String> NEGATIVE_WORDS = List.of(
            "bad", "terrible", "awful", "hate", "disappointed", "angry", "frustrated", "not good", "worst",
            "bura", "kharab", "bekaar");

    private static final Map<String, List<String>> PHRASE_CATEGORIES = new LinkedHashMap<>();

    static {
        PHRASE_CATEGORIES.put("buying_signal", List.of(
                "yes", "okay", "book", "interested", "sounds good", "haan", "theek hai", "bilkul"));
        PHRASE_CATEGORIES.put("objection", List.of(
                "expensive", "think", "later", "mahanga", "soch", "baad mein"));
        PHRASE_CATEGORIES.put("urgency", List.of(
                "urgent", "immediate", "asap", "jaldi"));
        PHRASE_CATEGORIES.put("interest", List.of(
                "tell me more", "aur batao", "explain", "how does it work"));
    }

    /**
     * +0.5 when positive words outnumber negative ones, -0.5 for the reverse, otherwise 0.
     */
    public double sentiment(String text) {
        if (StringUtils.isBlank(text)) return 0;
        String lower = text.toLowerCase();
        long positive = POSITIVE_WORDS.stream().filter(lower::contains).count();
        long negative = NEGATIVE_WORDS.stream().filter(lower::contains).count();
        if (positive > negative) return POSITIVE;
        if (negative > positive) return NEGATIVE;
        return 0;
    }

    /**
     * Matched phrase to its category, in category order. A phrase is reported once.
     */
    public Map<String, String> keyPhrases(String text) {
        Map<String, String> found = new LinkedHashMap<>();
        if (StringUtils.isBlank(text)) return found;
        String lower = text.toLowerCase();
        PHRASE_CATEGORIES.forEach((category, phrases) -> {
            for (String phrase : phrases) {
                if (lower.contains(phrase)) {
                    found.putIfAbsent(phrase, category);
                }
            }
        });
        return found;
    }
}
