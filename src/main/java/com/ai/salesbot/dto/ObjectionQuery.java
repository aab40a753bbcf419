package com.ai.salesbot.dto;

import com.ai.salesbot.utils.Language;
import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ObjectionQuery {
    @JsonAlias("userInput")
    private String utterance;
    private Language language;
}
