package com.ai.salesbot.websocket;

import com.ai.salesbot.dto.CallLifecycleEvent;
import com.ai.salesbot.dto.DashboardEvent;
import com.ai.salesbot.entity.CallSession;
import com.ai.salesbot.exception.NotFoundException;
import com.ai.salesbot.exception.ValidationException;
import com.ai.salesbot.service.CallSessionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dashboard socket. Observers send {@code join-room} and get a full state snapshot back;
 * the voice engine sends lifecycle frames that are applied to the call registry.
 */
@Component
public class DashboardSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(DashboardSocketHandler.class);

    private final ObjectMapper mapper;
    private final EventBroadcaster broadcaster;
    private final CallSessionService callSessionService;

    public DashboardSocketHandler(ObjectMapper mapper,
                                  EventBroadcaster broadcaster,
                                  CallSessionService callSessionService) {
        this.mapper = mapper;
        this.broadcaster = broadcaster;
        this.callSessionService = callSessionService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        broadcaster.register(session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        JsonNode root;
        try {
            root = mapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            replyError(session, null, "Malformed frame");
            return;
        }
        String event = root.path("event").asText("");

        try {
            switch (event) {
                case "join-room":
                    joinRoom(session, root.path("role").asText(null));
                    break;
                case "leave-room":
                    broadcaster.leave(session.getId(), root.path("role").asText(null));
                    break;
                case DashboardEvent.CALL_STARTED:
                    callSessionService.startCall(frame(root));
                    break;
                case DashboardEvent.CALL_UPDATED: {
                    CallLifecycleEvent frame = frame(root);
                    callSessionService.updateCall(frame.getCallId(), frame);
                    break;
                }
                case DashboardEvent.CALL_ENDED: {
                    CallLifecycleEvent frame = frame(root);
                    callSessionService.endCall(frame.getCallId(), frame.getStatus(), frame.getTranscript(),
                            frame.getAudioRef(), frame.getSatisfaction());
                    break;
                }
                case DashboardEvent.CALL_INTERRUPTED:
                    callSessionService.recordInterruption(frame(root).getCallId());
                    break;
                case "transcript": {
                    CallLifecycleEvent frame = frame(root);
                    callSessionService.appendTranscript(frame.getCallId(), frame.getTranscript());
                    break;
                }
                default:
                    replyError(session, null, "Unknown event: " + event);
            }
        } catch (NotFoundException | ValidationException e) {
            log.warn("Rejected frame | sessionId={} event={} reason={}", session.getId(), event, e.getMessage());
            replyError(session, root.path("callId").asText(null), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to apply frame | sessionId={} event={}", session.getId(), event, e);
            replyError(session, root.path("callId").asText(null), "Failed to process " + event);
        }
    }

    private void joinRoom(WebSocketSession session, String role) {
        broadcaster.join(session.getId(), role);
        List<CallSession> active = callSessionService.listActive();
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("role", StringUtils.defaultIfBlank(role, "viewer"));
        snapshot.put("activeCalls", active);
        snapshot.put("activeCount", active.size());
        broadcaster.sendTo(session.getId(), DashboardEvent.of(DashboardEvent.STATE_SNAPSHOT, null, snapshot));
    }

    private CallLifecycleEvent frame(JsonNode root) {
        JsonNode body = root.has("data") ? root.path("data") : root;
        CallLifecycleEvent frame;
        try {
            frame = mapper.treeToValue(body, CallLifecycleEvent.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed lifecycle frame: " + e.getOriginalMessage());
        }
        if (StringUtils.isBlank(frame.getCallId())) {
            frame.setCallId(root.path("callId").asText(null));
        }
        return frame;
    }

    private void replyError(WebSocketSession session, String callId, String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", message);
        broadcaster.sendTo(session.getId(), DashboardEvent.of(DashboardEvent.ERROR, callId, data));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error | sessionId={} error={}", session.getId(), exception.getMessage());
        broadcaster.unregister(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        broadcaster.unregister(session.getId());
        log.debug("Dashboard socket closed | sessionId={} status={}", session.getId(), status);
    }
}
