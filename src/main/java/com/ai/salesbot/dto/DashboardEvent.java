package com.ai.salesbot.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Frame pushed to dashboard subscribers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DashboardEvent {

    public static final String CALL_STARTED = "call-started";
    public static final String CALL_UPDATED = "call-updated";
    public static final String CALL_ENDED = "call-ended";
    public static final String CALL_INTERRUPTED = "call-interrupted";
    public static final String CALL_TERMINATED = "call-terminated";
    public static final String CALL_RECLAIMED = "call-reclaimed";
    public static final String TRANSCRIPT_UPDATED = "transcript-updated";
    public static final String QUALIFICATION_UPDATED = "qualification-updated";
    public static final String ANALYTICS_UPDATED = "analytics-updated";
    public static final String SYSTEM_HEALTH = "system-health";
    public static final String STATE_SNAPSHOT = "state-snapshot";
    public static final String ERROR = "error";

    private String event;
    private String callId;
    private Object data;
    private Instant timestamp;

    public static DashboardEvent of(String event, String callId, Object data) {
        return new DashboardEvent(event, callId, data, Instant.now());
    }
}
