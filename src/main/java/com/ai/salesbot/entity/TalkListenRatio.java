package com.ai.salesbot.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * Share of the call the bot spent talking. {@code ratio} is derived from the two talk times.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TalkListenRatio {

    public static final double DEFAULT_TARGET = 0.4;

    @Column(name = "ai_talk_time", nullable = false)
    @Builder.Default
    private double aiTalkTime = 0;

    @Column(name = "user_talk_time", nullable = false)
    @Builder.Default
    private double userTalkTime = 0;

    @Setter(AccessLevel.NONE)
    @Column(name = "talk_ratio", nullable = false)
    @Builder.Default
    private double ratio = 0;

    @Column(name = "target_ratio", nullable = false)
    @Builder.Default
    private double targetRatio = DEFAULT_TARGET;

    /**
     * AI talk time over total talk time, 0 when nobody has spoken yet.
     */
    public double recomputeRatio() {
        double total = aiTalkTime + userTalkTime;
        this.ratio = total > 0 ? aiTalkTime / total : 0;
        return ratio;
    }
}
