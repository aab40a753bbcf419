package com.ai.salesbot.dto;

import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.ObjectionType;
import com.ai.salesbot.utils.ScriptType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Conversation state a script must fit. When {@code callId} is set, elapsed time and
 * qualification score are read from the call instead of the request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScriptSelectionRequest {
    private Long productId;
    private ScriptType scriptType;
    private Language language;
    private String callId;
    private Long elapsedSeconds;
    private Integer qualificationScore;
    private String utterance;
    private Set<ObjectionType> detectedObjections;
}
