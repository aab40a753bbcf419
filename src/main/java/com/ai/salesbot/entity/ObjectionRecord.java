package com.ai.salesbot.entity;

import com.ai.salesbot.utils.ObjectionType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ObjectionRecord {

    @Enumerated(EnumType.STRING)
    @Column(name = "objection_type", nullable = false, length = 20)
    private ObjectionType objectionType;

    @Column(name = "raised_at", nullable = false)
    private Instant timestamp;

    @Column(nullable = false)
    private boolean resolved;

    /** Seconds from being raised to being resolved. */
    @Column(name = "resolution_time")
    private Long resolutionTime;

    @Column(name = "technique_used", length = 50)
    private String techniqueUsed;
}
