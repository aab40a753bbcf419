package com.ai.salesbot.dto;

import com.ai.salesbot.utils.QualificationStage;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial BANT update. Null fields leave the stored values untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class QualificationUpdate {
    private Integer budget;
    private Integer authority;
    private Integer need;
    private Integer timeline;
    private String budgetNotes;
    private String authorityNotes;
    private String needNotes;
    private String timelineNotes;
    private QualificationStage stage;
    private String notes;
}
