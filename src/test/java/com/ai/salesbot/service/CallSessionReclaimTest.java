package com.ai.salesbot.service;

import com.ai.salesbot.dto.CallEndedEvent;
import com.ai.salesbot.dto.DashboardEvent;
import com.ai.salesbot.entity.CallSession;
import com.ai.salesbot.repository.CallSessionRepository;
import com.ai.salesbot.utils.CallStatus;
import com.ai.salesbot.websocket.EventBroadcaster;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Reclaim re-reads each stale candidate under a row lock before writing it.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CallSessionService reclaim under concurrent writers")
class CallSessionReclaimTest {

    @Mock
    private CallSessionRepository repository;

    @Mock
    private EventBroadcaster broadcaster;

    @Mock
    private ApplicationEventPublisher events;

    private CallSessionService service;

    @BeforeEach
    void setUp() {
        service = new CallSessionService(repository, broadcaster, events, 3600, 300);
    }

    @Test
    @DisplayName("a call that ended between the scan and the lock keeps its terminal status")
    void endedAfterScan() {
        CallSession ended = CallSession.builder()
                .callId("CA-RACE")
                .status(CallStatus.SUCCESS)
                .startTime(Instant.now().minusSeconds(7200))
                .endTime(Instant.now())
                .build();
        when(repository.findCallIdsByStatusAndStartTimeBefore(eq(CallStatus.IN_PROGRESS), any()))
                .thenReturn(List.of("CA-RACE"));
        when(repository.findByCallIdForUpdate("CA-RACE")).thenReturn(Optional.of(ended));

        List<CallSession> reclaimed = service.reclaimStuck();

        assertThat(reclaimed).isEmpty();
        assertThat(ended.getStatus()).isEqualTo(CallStatus.SUCCESS);
        assertThat(ended.getMetadata()).doesNotContainKey("cleanup_reason");
        verify(repository, never()).save(any());
        verify(broadcaster, never()).publish(anyString(), anyString(), any());
        verify(events, never()).publishEvent(any(CallEndedEvent.class));
    }

    @Test
    @DisplayName("the locked row is the one written, so counters committed after the scan are kept")
    void writesLockedRow() {
        CallSession fresh = CallSession.builder()
                .callId("CA-LIVE")
                .startTime(Instant.now().minusSeconds(7200))
                .interruptionCount(4)
                .build();
        when(repository.findCallIdsByStatusAndStartTimeBefore(eq(CallStatus.IN_PROGRESS), any()))
                .thenReturn(List.of("CA-LIVE"));
        when(repository.findByCallIdForUpdate("CA-LIVE")).thenReturn(Optional.of(fresh));
        when(repository.save(fresh)).thenReturn(fresh);

        List<CallSession> reclaimed = service.reclaimStuck();

        assertThat(reclaimed).containsExactly(fresh);
        assertThat(fresh.getStatus()).isEqualTo(CallStatus.FAILED);
        assertThat(fresh.getInterruptionCount()).isEqualTo(4);
        assertThat(fresh.getMetadata()).containsEntry("cleanup_reason", CallSessionService.REASON_TIMEOUT);
        verify(broadcaster).publish(eq(DashboardEvent.CALL_RECLAIMED), eq("CA-LIVE"), any());
        verify(events).publishEvent(any(CallEndedEvent.class));
    }

    @Test
    @DisplayName("a candidate deleted before the lock is skipped")
    void purgedAfterScan() {
        when(repository.findCallIdsByStatusAndStartTimeBefore(eq(CallStatus.IN_PROGRESS), any()))
                .thenReturn(List.of("CA-GONE"));
        when(repository.findByCallIdForUpdate("CA-GONE")).thenReturn(Optional.empty());

        assertThat(service.reclaimStuck()).isEmpty();
        verify(repository, never()).save(any());
    }
}
