package com.ai.salesbot.dto;

import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.ObjectionType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Every objection category found in one utterance. May be empty; never ranked.
 */
public final class ObjectionDetection {

    private final Set<ObjectionType> matchedTypes;
    private final String utterance;
    private final Language language;

    public ObjectionDetection(Set<ObjectionType> matchedTypes, String utterance, Language language) {
        this.matchedTypes = matchedTypes == null || matchedTypes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(matchedTypes));
        this.utterance = utterance;
        this.language = language;
    }

    public Set<ObjectionType> getMatchedTypes() {
        return matchedTypes;
    }

    public String getUtterance() {
        return utterance;
    }

    public Language getLanguage() {
        return language;
    }

    public boolean hasObjection() {
        return !matchedTypes.isEmpty();
    }

    public boolean has(ObjectionType type) {
        return matchedTypes.contains(type);
    }

    public static ObjectionDetection none(String utterance, Language language) {
        return new ObjectionDetection(Collections.emptySet(), utterance, language);
    }
}
