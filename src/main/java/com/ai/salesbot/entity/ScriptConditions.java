package com.ai.salesbot.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * Numeric eligibility limits of a script. Null means no limit.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScriptConditions {

    @Column(name = "min_qualification_score")
    private Integer minQualificationScore;

    /** Seconds. */
    @Column(name = "max_call_duration")
    private Long maxCallDuration;
}
