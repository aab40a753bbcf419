package com.ai.salesbot.dto;

import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.ScriptType;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UtteranceRequest {
    @JsonAlias({"text", "userInput"})
    private String utterance;
    private Language language;
    private Long productId;
    private ScriptType scriptType;
}
