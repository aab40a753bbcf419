package com.ai.salesbot.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.time.Instant;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KeyPhrase {

    @Column(nullable = false, length = 100)
    private String phrase;

    /** buying_signal, objection, urgency or interest. */
    @Column(length = 30)
    private String category;

    @Column(name = "mentioned_at", nullable = false)
    private Instant timestamp;

    @Column(length = 500)
    private String context;
}
