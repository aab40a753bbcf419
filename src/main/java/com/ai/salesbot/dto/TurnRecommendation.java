package com.ai.salesbot.dto;

import com.ai.salesbot.utils.ObjectionType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * What the voice engine should do with the utterance it just heard.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TurnRecommendation {
    private String callId;
    private Set<ObjectionType> detectedObjections;
    private double sentiment;
    private HandlerView handler;
    private ScriptView script;
    private int qualificationScore;
    private long elapsedSeconds;
}
