package com.ai.salesbot.dto;

import com.ai.salesbot.utils.ConversionStage;
import com.ai.salesbot.utils.ObjectionType;
import com.ai.salesbot.utils.OutcomeType;
import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

/**
 * Request body for the per-call analytics writes. Each endpoint reads only the fields it needs.
 */
@Data
public class AnalyticsWrite {

    private String objectionType;
    private String technique;
    private String stage;
    private Boolean success;

    @JsonAlias("sentiment")
    private Double score;
    private String text;

    private Double aiTalkTime;
    private Double userTalkTime;

    private String phrase;
    private String category;
    private String context;

    private ConversionStage conversionStage;
    private OutcomeType outcome;

    public ObjectionType objectionTypeValue() {
        return ObjectionType.fromCode(objectionType);
    }
}
