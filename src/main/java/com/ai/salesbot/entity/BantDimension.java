package com.ai.salesbot.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * One BANT axis: a 0..10 score and free-text notes.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BantDimension {

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 10;

    @Column(nullable = false)
    @Builder.Default
    private int score = 0;

    @Column(length = 1000)
    private String notes;

    public int clampedScore() {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
