package com.ai.salesbot.websocket;

import com.ai.salesbot.dto.DashboardEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans dashboard events out to connected subscribers.
 * <p>
 * Payloads are serialized once on the publishing thread and, after the surrounding
 * transaction commits (or at once outside one), appended to a per-subscriber
 * lane under one fan-out lock, so every subscriber sees the same event order. Each lane is
 * drained by at most one task at a time on the shared dispatcher pool. A subscriber whose
 * current send has run past the send time limit, or whose lane backs up beyond
 * {@code maxPending}, is dropped and closed. Nothing here ever throws back into the publisher.
 */
@Component
public class EventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final Object fanOutLock = new Object();

    private final ObjectMapper mapper;
    private final Executor dispatcher;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;
    private final int maxPending;

    public EventBroadcaster(ObjectMapper mapper,
                            @Qualifier("broadcastDispatcher") Executor dispatcher,
                            @Value("${salesbot.broadcast.send-time-limit-ms:5000}") int sendTimeLimitMs,
                            @Value("${salesbot.broadcast.buffer-size-limit:524288}") int bufferSizeLimit,
                            @Value("${salesbot.broadcast.max-pending:256}") int maxPending) {
        this.mapper = mapper;
        this.dispatcher = dispatcher;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
        this.maxPending = maxPending;
    }

    static class Subscriber {
        final WebSocketSession session;
        final Set<String> roles = ConcurrentHashMap.newKeySet();
        final Queue<String> lane = new ConcurrentLinkedQueue<>();
        final AtomicInteger depth = new AtomicInteger();
        final AtomicBoolean draining = new AtomicBoolean();
        volatile long sendStartedAt;
        volatile boolean dropped;

        Subscriber(WebSocketSession session) {
            this.session = session;
        }

        boolean receives(String targetRole) {
            if (roles.isEmpty()) return false;
            return targetRole == null || roles.contains(targetRole);
        }

        boolean stalled(long now, int limitMs) {
            long started = sendStartedAt;
            return started != 0 && now - started > limitMs;
        }
    }

    public void register(WebSocketSession session) {
        WebSocketSession bounded = new ConcurrentWebSocketSessionDecorator(
                session, sendTimeLimitMs, bufferSizeLimit,
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.TERMINATE);
        subscribers.put(session.getId(), new Subscriber(bounded));
        log.debug("Subscriber connected | sessionId={}", session.getId());
    }

    /**
     * Adds the subscriber to a role group. Events only reach subscribers that joined at least one group.
     */
    public boolean join(String sessionId, String role) {
        Subscriber s = subscribers.get(sessionId);
        if (s == null) return false;
        s.roles.add(StringUtils.defaultIfBlank(role, "viewer").trim().toLowerCase());
        log.info("Subscriber joined | sessionId={} roles={}", sessionId, s.roles);
        return true;
    }

    public void leave(String sessionId, String role) {
        Subscriber s = subscribers.get(sessionId);
        if (s != null && role != null) {
            s.roles.remove(role.trim().toLowerCase());
        }
    }

    public void unregister(String sessionId) {
        Subscriber s = subscribers.remove(sessionId);
        if (s != null) {
            s.dropped = true;
            s.lane.clear();
            log.debug("Subscriber removed | sessionId={}", sessionId);
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public void publish(String event, String callId, Object data) {
        publish(DashboardEvent.of(event, callId, data), null);
    }

    /**
     * Sends to every joined subscriber, or only to members of {@code targetRole} when given.
     */
    public void publish(DashboardEvent event, String targetRole) {
        String payload = serialize(event);
        if (payload == null) return;
        String role = targetRole == null ? null : targetRole.trim().toLowerCase();
        afterCommit(() -> fanOut(payload, role));
    }

    private void fanOut(String payload, String role) {
        synchronized (fanOutLock) {
            for (Subscriber s : subscribers.values()) {
                if (s.receives(role)) {
                    enqueue(s, payload);
                }
            }
        }
    }

    /**
     * Inside a transaction the event is held until commit and discarded on rollback.
     */
    private void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    /**
     * Sends to one subscriber regardless of its groups. Used for snapshots and error replies.
     */
    public void sendTo(String sessionId, DashboardEvent event) {
        String payload = serialize(event);
        if (payload == null) return;
        Subscriber s = subscribers.get(sessionId);
        if (s == null) return;
        synchronized (fanOutLock) {
            enqueue(s, payload);
        }
    }

    private void enqueue(Subscriber s, String payload) {
        if (s.dropped) return;
        if (s.stalled(System.currentTimeMillis(), sendTimeLimitMs)) {
            drop(s, "send time limit exceeded");
            return;
        }
        if (s.depth.incrementAndGet() > maxPending) {
            drop(s, "backlog over " + maxPending);
            return;
        }
        s.lane.add(payload);
        schedule(s);
    }

    private void schedule(Subscriber s) {
        if (!s.draining.compareAndSet(false, true)) return;
        try {
            dispatcher.execute(() -> drain(s));
        } catch (RuntimeException e) {
            s.draining.set(false);
            log.warn("Broadcast dispatcher rejected lane | sessionId={} error={}", s.session.getId(), e.getMessage());
        }
    }

    private void drain(Subscriber s) {
        try {
            String payload;
            while ((payload = s.lane.poll()) != null) {
                s.depth.decrementAndGet();
                if (!deliver(s, payload)) return;
            }
        } finally {
            s.draining.set(false);
        }
        // an enqueue may have lost the race with the flag reset above
        if (!s.dropped && !s.lane.isEmpty()) {
            schedule(s);
        }
    }

    private boolean deliver(Subscriber s, String payload) {
        WebSocketSession session = s.session;
        if (s.dropped) return false;
        if (!session.isOpen()) {
            unregister(session.getId());
            return false;
        }
        s.sendStartedAt = System.currentTimeMillis();
        try {
            session.sendMessage(new TextMessage(payload));
            return true;
        } catch (IOException | RuntimeException e) {
            drop(s, e.getMessage());
            return false;
        } finally {
            s.sendStartedAt = 0;
        }
    }

    private void drop(Subscriber s, String reason) {
        WebSocketSession session = s.session;
        if (!subscribers.remove(session.getId(), s)) {
            s.dropped = true;
            return;
        }
        s.dropped = true;
        s.lane.clear();
        log.warn("Dropping unreachable subscriber | sessionId={} reason={}", session.getId(), reason);
        closeQuietly(session);
    }

    private void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("Close failed | sessionId={} error={}", session.getId(), e.getMessage());
        }
    }

    private String serialize(DashboardEvent event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize event {}: {}", event.getEvent(), e.getMessage());
            return null;
        }
    }
}
