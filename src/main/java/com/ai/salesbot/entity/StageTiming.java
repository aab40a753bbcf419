package com.ai.salesbot.entity;

import com.ai.salesbot.utils.ConversionStage;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StageTiming {

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 15)
    private ConversionStage stage;

    @Column(name = "started_at", nullable = false)
    private Instant startTime;

    @Column(name = "ended_at")
    private Instant endTime;

    /** Seconds spent in the stage, set when the stage closes. */
    private Long duration;

    public boolean isOpen() {
        return endTime == null;
    }
}
