package com.ai.salesbot.dto;

import com.ai.salesbot.utils.CallDirection;
import com.ai.salesbot.utils.CallStatus;
import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.Satisfaction;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Lifecycle frame sent by the voice engine, over the dashboard socket or REST.
 * Only {@code callId} is required; every other field is applied when present.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CallLifecycleEvent {
    private String event;
    private String callId;
    private String caller;
    private String receiver;
    /** Accepts the original {@code type} field name as well. */
    private CallDirection direction;
    private Language language;
    private Instant startTime;
    private CallStatus status;
    private String transcript;
    private Satisfaction satisfaction;
    private String audioRef;
    private Map<String, String> metadata;

    public void setType(CallDirection type) {
        if (direction == null) {
            this.direction = type;
        }
    }

    public void setAudioFile(String audioFile) {
        if (audioRef == null) {
            this.audioRef = audioFile;
        }
    }
}
