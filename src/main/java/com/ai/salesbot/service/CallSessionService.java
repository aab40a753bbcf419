package com.ai.salesbot.service;

import com.ai.salesbot.dto.CallEndedEvent;
import com.ai.salesbot.dto.CallLifecycleEvent;
import com.ai.salesbot.dto.CallStats;
import com.ai.salesbot.dto.DashboardEvent;
import com.ai.salesbot.dto.DateRange;
import com.ai.salesbot.dto.HealthSnapshot;
import com.ai.salesbot.entity.CallSession;
import com.ai.salesbot.exception.NotFoundException;
import com.ai.salesbot.exception.ValidationException;
import com.ai.salesbot.repository.CallSessionRepository;
import com.ai.salesbot.utils.CallDirection;
import com.ai.salesbot.utils.CallStatus;
import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.Satisfaction;
import com.ai.salesbot.websocket.EventBroadcaster;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.lang.management.ManagementFactory;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Call lifecycle: in-progress, then exactly one terminal status. Terminal states are absorbing.
 */
@Service
public class CallSessionService {

    private static final Logger log = LoggerFactory.getLogger(CallSessionService.class);

    public static final String REASON_TIMEOUT = "stuck_call_timeout";
    public static final String REASON_MANUAL = "manual_cleanup";

    static final String META_CLEANUP_REASON = "cleanup_reason";
    static final String META_ORIGINAL_STATUS = "original_status";
    static final String META_TERMINATED_BY = "terminated_by";

    private final CallSessionRepository repository;
    private final EventBroadcaster broadcaster;
    private final ApplicationEventPublisher events;
    private final long stuckThresholdSeconds;
    private final long recentWindowSeconds;

    public CallSessionService(CallSessionRepository repository,
                              EventBroadcaster broadcaster,
                              ApplicationEventPublisher events,
                              @Value("${salesbot.calls.stuck-threshold-seconds:3600}") long stuckThresholdSeconds,
                              @Value("${salesbot.broadcast.recent-window-seconds:300}") long recentWindowSeconds) {
        this.repository = repository;
        this.broadcaster = broadcaster;
        this.events = events;
        this.stuckThresholdSeconds = stuckThresholdSeconds;
        this.recentWindowSeconds = recentWindowSeconds;
    }

    public CallSession startCall(String callId, CallDirection direction, String caller, String receiver,
                                 Language language, Map<String, String> metadata) {
        return startCall(CallLifecycleEvent.builder()
                .callId(callId)
                .direction(direction)
                .caller(caller)
                .receiver(receiver)
                .language(language)
                .metadata(metadata)
                .build());
    }

    /**
     * Creates the session, or returns the existing one for a repeated id.
     * Runs without an outer transaction so a lost unique-key race can be re-read.
     */
    public CallSession startCall(CallLifecycleEvent event) {
        String callId = requireCallId(event.getCallId());
        Optional<CallSession> existing = repository.findByCallId(callId);
        if (existing.isPresent()) {
            log.debug("Duplicate start ignored | callId={}", callId);
            return existing.get();
        }

        CallSession session = CallSession.builder()
                .callId(callId)
                .direction(event.getDirection() != null ? event.getDirection() : CallDirection.OUTBOUND)
                .caller(event.getCaller())
                .receiver(event.getReceiver())
                .language(event.getLanguage() != null ? event.getLanguage() : Language.EN)
                .startTime(event.getStartTime() != null ? event.getStartTime() : Instant.now())
                .metadata(event.getMetadata() != null ? new HashMap<>(event.getMetadata()) : new HashMap<>())
                .build();
        try {
            session = repository.saveAndFlush(session);
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent start lost the insert race | callId={}", callId);
            return repository.findByCallId(callId).orElseThrow(() -> e);
        }

        log.info("Call started | callId={} direction={} caller={} receiver={}",
                callId, session.getDirection().getCode(), session.getCaller(), session.getReceiver());
        broadcaster.publish(DashboardEvent.CALL_STARTED, callId, session);
        return session;
    }

    /**
     * Merges the present fields into a running call. Terminal calls are returned unchanged.
     */
    @Transactional
    public CallSession updateCall(String callId, CallLifecycleEvent patch) {
        CallSession session = repository.findByCallIdForUpdate(requireCallId(callId))
                .orElseThrow(() -> NotFoundException.of("Call", callId));
        if (session.getStatus().isTerminal()) {
            log.debug("Update ignored on finished call | callId={} status={}", callId, session.getStatus().getCode());
            return session;
        }
        if (patch.getCaller() != null) session.setCaller(patch.getCaller());
        if (patch.getReceiver() != null) session.setReceiver(patch.getReceiver());
        if (patch.getDirection() != null) session.setDirection(patch.getDirection());
        if (patch.getLanguage() != null) session.setLanguage(patch.getLanguage());
        if (patch.getSatisfaction() != null) session.setSatisfaction(patch.getSatisfaction());
        if (patch.getAudioRef() != null) session.setAudioRef(patch.getAudioRef());
        if (patch.getMetadata() != null) session.getMetadata().putAll(patch.getMetadata());

        session = repository.save(session);
        broadcaster.publish(DashboardEvent.CALL_UPDATED, callId, session);
        return session;
    }

    @Transactional
    public CallSession appendTranscript(String callId, String delta) {
        CallSession session = repository.findByCallIdForUpdate(requireCallId(callId))
                .orElseThrow(() -> NotFoundException.of("Call", callId));
        if (StringUtils.isEmpty(delta)) {
            return session;
        }
        session.setTranscript(StringUtils.defaultString(session.getTranscript()) + delta);
        session = repository.save(session);

        Map<String, Object> data = new HashMap<>();
        data.put("delta", delta);
        data.put("transcript", session.getTranscript());
        broadcaster.publish(DashboardEvent.TRANSCRIPT_UPDATED, callId, data);
        return session;
    }

    @Transactional
    public CallSession recordInterruption(String rawCallId) {
        String callId = requireCallId(rawCallId);
        if (repository.incrementInterruptions(callId, Instant.now()) == 0) {
            throw NotFoundException.of("Call", callId);
        }
        CallSession session = repository.findByCallId(callId)
                .orElseThrow(() -> NotFoundException.of("Call", callId));
        log.debug("Interruption recorded | callId={} count={}", callId, session.getInterruptionCount());

        Map<String, Object> data = new HashMap<>();
        data.put("interruptionCount", session.getInterruptionCount());
        broadcaster.publish(DashboardEvent.CALL_INTERRUPTED, callId, data);
        return session;
    }

    /**
     * Natural end of a call. Applies only while the call is still in progress, so it can never
     * overwrite an operator termination. Returns empty when the call is missing.
     */
    @Transactional
    public Optional<CallSession> endCall(String rawCallId, CallStatus status, String transcript,
                                         String audioRef, Satisfaction satisfaction) {
        String callId = requireCallId(rawCallId);
        CallStatus finalStatus = status != null ? status : CallStatus.SUCCESS;
        if (!finalStatus.isTerminal()) {
            throw new ValidationException("End status must be terminal, got " + finalStatus.getCode());
        }

        Optional<CallSession> current = repository.findByCallId(callId);
        if (current.isEmpty()) {
            log.debug("End ignored for unknown call | callId={}", callId);
            return Optional.empty();
        }
        if (current.get().getStatus().isTerminal()) {
            log.debug("End ignored on finished call | callId={} status={}", callId, current.get().getStatus().getCode());
            return current;
        }

        Instant endTime = Instant.now();
        long duration = CallSession.secondsBetween(current.get().getStartTime(), endTime);
        int updated = repository.finishIfInProgress(callId, finalStatus, endTime, duration,
                StringUtils.defaultIfEmpty(transcript, null), StringUtils.defaultIfEmpty(audioRef, null), satisfaction);

        CallSession session = repository.findByCallId(callId)
                .orElseThrow(() -> NotFoundException.of("Call", callId));
        if (updated == 0) {
            log.debug("End lost to a concurrent finish | callId={} status={}", callId, session.getStatus().getCode());
            return Optional.of(session);
        }

        log.info("Call ended | callId={} status={} duration={}s", callId, finalStatus.getCode(), session.getDuration());
        broadcaster.publish(DashboardEvent.CALL_ENDED, callId, session);
        events.publishEvent(new CallEndedEvent(callId, finalStatus, session.getDuration(), endTime));
        return Optional.of(session);
    }

    /**
     * Operator hard stop. Writes unconditionally, so it wins against a concurrent natural end.
     */
    @Transactional
    public CallSession terminate(String callId) {
        CallSession session = repository.findByCallIdForUpdate(requireCallId(callId))
                .orElseThrow(() -> NotFoundException.of("Call", callId));
        if (session.getStatus().isTerminal()) {
            log.debug("Terminate ignored on finished call | callId={} status={}", callId, session.getStatus().getCode());
            return session;
        }

        Instant now = Instant.now();
        session.finish(CallStatus.FAILED, now);
        session.getMetadata().put(META_TERMINATED_BY, "operator");
        session = repository.save(session);

        log.info("Call terminated by operator | callId={} duration={}s", callId, session.getDuration());
        broadcaster.publish(DashboardEvent.CALL_TERMINATED, callId, session);
        events.publishEvent(new CallEndedEvent(callId, CallStatus.FAILED, session.getDuration(), now));
        return session;
    }

    /**
     * Fails every in-progress call older than {@code thresholdSeconds}, tagging the reason in metadata.
     * Each candidate is re-read under a row lock, so a call that finished or changed after the
     * scan is skipped or reclaimed with its latest counters.
     */
    @Transactional
    public List<CallSession> reclaimStuck(long thresholdSeconds, String reason) {
        Instant now = Instant.now();
        Instant cutoff = now.minusSeconds(thresholdSeconds);
        List<String> candidates = repository.findCallIdsByStatusAndStartTimeBefore(CallStatus.IN_PROGRESS, cutoff);
        if (candidates.isEmpty()) {
            return new ArrayList<>();
        }

        List<CallSession> reclaimed = new ArrayList<>(candidates.size());
        for (String callId : candidates) {
            Optional<CallSession> locked = repository.findByCallIdForUpdate(callId);
            if (locked.isEmpty()) continue;
            CallSession session = locked.get();
            if (session.getStatus() != CallStatus.IN_PROGRESS || !session.getStartTime().isBefore(cutoff)) {
                log.debug("Reclaim skipped | callId={} status={}", callId, session.getStatus().getCode());
                continue;
            }
            session.finish(CallStatus.FAILED, now);
            session.getMetadata().put(META_CLEANUP_REASON, reason);
            session.getMetadata().put(META_ORIGINAL_STATUS, CallStatus.IN_PROGRESS.getCode());
            reclaimed.add(repository.save(session));
        }
        repository.flush();

        for (CallSession session : reclaimed) {
            log.warn("Call reclaimed | callId={} reason={} age={}s", session.getCallId(), reason, session.getDuration());
            broadcaster.publish(DashboardEvent.CALL_RECLAIMED, session.getCallId(), session);
            events.publishEvent(new CallEndedEvent(session.getCallId(), CallStatus.FAILED, session.getDuration(), now));
        }
        return reclaimed;
    }

    @Transactional
    public List<CallSession> reclaimStuck() {
        return reclaimStuck(stuckThresholdSeconds, REASON_TIMEOUT);
    }

    @Transactional
    public List<CallSession> cleanupStuck() {
        return reclaimStuck(stuckThresholdSeconds, REASON_MANUAL);
    }

    /**
     * In-progress calls, newest first. Reclaims stale calls first so none past the threshold is returned.
     */
    @Transactional
    public List<CallSession> listActive() {
        reclaimStuck();
        return repository.findByStatusOrderByStartTimeDesc(CallStatus.IN_PROGRESS);
    }

    @Transactional(readOnly = true)
    public CallSession get(String callId) {
        return repository.findByCallId(requireCallId(callId))
                .orElseThrow(() -> NotFoundException.of("Call", callId));
    }

    @Transactional(readOnly = true)
    public Optional<CallSession> find(String callId) {
        if (StringUtils.isBlank(callId)) return Optional.empty();
        return repository.findByCallId(callId);
    }

    @Transactional(readOnly = true)
    public Page<CallSession> list(CallStatus status, CallDirection direction, DateRange range, Pageable pageable) {
        DateRange r = range != null ? range : DateRange.all();
        return repository.search(status, direction, r.getFrom(), r.getTo(), pageable);
    }

    @Transactional(readOnly = true)
    public CallStats stats(DateRange range) {
        DateRange r = range != null ? range : DateRange.all();
        List<CallSession> calls = repository.findByCreatedAtBetween(r.getFrom(), r.getTo());

        long success = 0, failed = 0, missed = 0, inProgress = 0, totalDuration = 0;
        for (CallSession c : calls) {
            switch (c.getStatus()) {
                case SUCCESS:
                    success++;
                    break;
                case FAILED:
                    failed++;
                    break;
                case MISSED:
                    missed++;
                    break;
                default:
                    inProgress++;
            }
            totalDuration += c.getDuration();
        }
        long total = calls.size();
        return CallStats.builder()
                .totalCalls(total)
                .successfulCalls(success)
                .failedCalls(failed)
                .missedCalls(missed)
                .inProgressCalls(inProgress)
                .successRate(total == 0 ? 0 : Math.round(success * 1000.0 / total) / 10.0)
                .averageDuration(total == 0 ? 0 : (double) totalDuration / total)
                .totalDuration(totalDuration)
                .build();
    }

    @Transactional(readOnly = true)
    public HealthSnapshot health() {
        long active = repository.countByStatus(CallStatus.IN_PROGRESS);
        long recent = repository.countByCreatedAtGreaterThanEqual(Instant.now().minusSeconds(recentWindowSeconds));
        long uptime = ManagementFactory.getRuntimeMXBean().getUptime() / 1000;
        return new HealthSnapshot(active, recent, broadcaster.subscriberCount(), uptime);
    }

    /**
     * Administrative delete. The only way a session is ever removed.
     */
    @Transactional
    public void purge(String callId) {
        CallSession session = repository.findByCallId(requireCallId(callId))
                .orElseThrow(() -> NotFoundException.of("Call", callId));
        repository.delete(session);
        log.info("Call purged | callId={}", callId);
    }

    private static String requireCallId(String callId) {
        if (StringUtils.isBlank(callId)) {
            throw new ValidationException("callId is required");
        }
        return callId.trim();
    }
}
