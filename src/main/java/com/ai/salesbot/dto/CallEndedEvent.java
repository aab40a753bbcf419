package com.ai.salesbot.dto;

import com.ai.salesbot.utils.CallStatus;

import java.time.Instant;

/**
 * Published in-process once a call reaches a terminal status, whichever path got it there.
 */
public class CallEndedEvent {

    private final String callId;
    private final CallStatus status;
    private final long duration;
    private final Instant endTime;

    public CallEndedEvent(String callId, CallStatus status, long duration, Instant endTime) {
        this.callId = callId;
        this.status = status;
        this.duration = duration;
        this.endTime = endTime;
    }

    public String getCallId() {
        return callId;
    }

    public CallStatus getStatus() {
        return status;
    }

    public long getDuration() {
        return duration;
    }

    public Instant getEndTime() {
        return endTime;
    }
}
