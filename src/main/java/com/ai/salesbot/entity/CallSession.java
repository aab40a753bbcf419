package com.ai.salesbot.entity;

import com.ai.salesbot.utils.CallDirection;
import com.ai.salesbot.utils.CallStatus;
import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.Satisfaction;
import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * One phone call handled by the bot. Written only by {@code CallSessionService}.
 */
@Entity
@Table(name = "call_session", indexes = {
    @Index(name = "idx_call_session_call_id", columnList = "call_id", unique = true),
    @Index(name = "idx_call_session_status_start", columnList = "status, start_time")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CallSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "call_id", nullable = false, unique = true, length = 100)
    private String callId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private CallDirection direction = CallDirection.OUTBOUND;

    @Column(length = 50)
    private String caller;

    @Column(length = 50)
    private String receiver;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 15)
    @Builder.Default
    private CallStatus status = CallStatus.IN_PROGRESS;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    /** Seconds between start and end, 0 while the call is running. */
    @Builder.Default
    private long duration = 0L;

    @Column(length = 100000)
    @Builder.Default
    private String transcript = "";

    @Column(name = "audio_ref")
    private String audioRef;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    @Builder.Default
    private Satisfaction satisfaction = Satisfaction.UNKNOWN;

    @Column(name = "interruption_count", nullable = false)
    @Builder.Default
    private int interruptionCount = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private Language language = Language.EN;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "call_session_metadata", joinColumns = @JoinColumn(name = "session_id"))
    @MapKeyColumn(name = "meta_key", length = 100)
    @Column(name = "meta_value", length = 500)
    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    private Instant createdAt;

    private Instant updatedAt;

    /**
     * Marks the call terminal. Duration is always derived from the two timestamps.
     */
    public void finish(CallStatus finalStatus, Instant at) {
        this.status = finalStatus;
        this.endTime = at;
        this.duration = secondsBetween(startTime, at);
    }

    public long elapsedSeconds(Instant now) {
        return secondsBetween(startTime, endTime != null ? endTime : now);
    }

    public static long secondsBetween(Instant from, Instant to) {
        if (from == null || to == null) return 0L;
        return Math.max(0L, Duration.between(from, to).getSeconds());
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
        if (startTime == null) startTime = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
        if (endTime != null) {
            duration = secondsBetween(startTime, endTime);
        }
    }
}
