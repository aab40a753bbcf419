package com.ai.salesbot.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.time.Instant;

/**
 * Sentiment of one utterance, -1 (negative) to 1 (positive).
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SentimentSample {

    @Column(name = "sampled_at", nullable = false)
    private Instant timestamp;

    @Column(nullable = false)
    private double score;

    @Column(length = 500)
    private String text;
}
