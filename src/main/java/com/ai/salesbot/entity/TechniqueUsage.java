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
public class TechniqueUsage {

    @Column(nullable = false, length = 50)
    private String technique;

    @Column(length = 30)
    private String stage;

    @Column(name = "used_at", nullable = false)
    private Instant timestamp;

    @Column(nullable = false)
    private boolean success;
}
