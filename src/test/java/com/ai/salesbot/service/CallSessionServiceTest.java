package com.ai.salesbot.service;

import com.ai.salesbot.auth.SalesBotApplication;
import com.ai.salesbot.dto.CallEndedEvent;
import com.ai.salesbot.dto.CallLifecycleEvent;
import com.ai.salesbot.dto.DashboardEvent;
import com.ai.salesbot.entity.CallSession;
import com.ai.salesbot.exception.NotFoundException;
import com.ai.salesbot.exception.ValidationException;
import com.ai.salesbot.repository.CallSessionRepository;
import com.ai.salesbot.utils.CallDirection;
import com.ai.salesbot.utils.CallStatus;
import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.Satisfaction;
import com.ai.salesbot.websocket.EventBroadcaster;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DataJpaTest
@ContextConfiguration(classes = SalesBotApplication.class)
@Import(CallSessionService.class)
@RecordApplicationEvents
@DisplayName("CallSessionService")
class CallSessionServiceTest {

    @Autowired
    private CallSessionService service;

    @Autowired
    private CallSessionRepository repository;

    @Autowired
    private ApplicationEvents events;

    @MockBean
    private EventBroadcaster broadcaster;

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        @DisplayName("creates an in-progress session with defaults")
        void creates() {
            CallSession session = service.startCall("CA-1", null, "+911111", "+912222", null, null);

            assertThat(session.getStatus()).isEqualTo(CallStatus.IN_PROGRESS);
            assertThat(session.getDirection()).isEqualTo(CallDirection.OUTBOUND);
            assertThat(session.getLanguage()).isEqualTo(Language.EN);
            assertThat(session.getInterruptionCount()).isZero();
            assertThat(session.getTranscript()).isEmpty();
            verify(broadcaster).publish(eq(DashboardEvent.CALL_STARTED), eq("CA-1"), any());
        }

        @Test
        @DisplayName("a repeated id returns the existing session unchanged")
        void idempotent() {
            CallSession first = service.startCall("CA-2", CallDirection.INBOUND, "a", "b", Language.HI, null);
            CallSession second = service.startCall("CA-2", CallDirection.OUTBOUND, "x", "y", Language.EN, null);

            assertThat(second.getId()).isEqualTo(first.getId());
            assertThat(second.getCaller()).isEqualTo("a");
            assertThat(repository.count()).isEqualTo(1);
            verify(broadcaster, times(1)).publish(eq(DashboardEvent.CALL_STARTED), anyString(), any());
        }

        @Test
        @DisplayName("a blank id is rejected")
        void blankId() {
            assertThatThrownBy(() -> service.startCall(" ", null, null, null, null, null))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("end and terminate")
    class Finish {

        @Test
        @DisplayName("end sets a terminal status, end time and duration")
        void end() {
            service.startCall("CA-3", null, null, null, null, null);

            Optional<CallSession> ended = service.endCall("CA-3", CallStatus.SUCCESS, "bye", "s3://a.wav", Satisfaction.POSITIVE);

            assertThat(ended).isPresent();
            CallSession session = ended.get();
            assertThat(session.getStatus()).isEqualTo(CallStatus.SUCCESS);
            assertThat(session.getEndTime()).isNotNull();
            assertThat(session.getDuration()).isGreaterThanOrEqualTo(0);
            assertThat(session.getTranscript()).isEqualTo("bye");
            assertThat(session.getSatisfaction()).isEqualTo(Satisfaction.POSITIVE);
            assertThat(events.stream(CallEndedEvent.class)).hasSize(1);
        }

        @Test
        @DisplayName("end of an unknown call is empty, not an error")
        void endUnknown() {
            assertThat(service.endCall("nope", null, null, null, null)).isEmpty();
        }

        @Test
        @DisplayName("end with a non-terminal status is rejected")
        void endNonTerminal() {
            service.startCall("CA-4", null, null, null, null, null);

            assertThatThrownBy(() -> service.endCall("CA-4", CallStatus.IN_PROGRESS, null, null, null))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("a terminated call stays failed when the natural end arrives late")
        void terminateWins() {
            service.startCall("CA-5", null, null, null, null, null);

            CallSession terminated = service.terminate("CA-5");
            Optional<CallSession> lateEnd = service.endCall("CA-5", CallStatus.SUCCESS, null, null, null);

            assertThat(terminated.getStatus()).isEqualTo(CallStatus.FAILED);
            assertThat(terminated.getMetadata()).containsEntry("terminated_by", "operator");
            assertThat(lateEnd).map(CallSession::getStatus).contains(CallStatus.FAILED);
            assertThat(events.stream(CallEndedEvent.class)).hasSize(1);
        }

        @Test
        @DisplayName("terminate of an unknown call is not found")
        void terminateUnknown() {
            assertThatThrownBy(() -> service.terminate("nope")).isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("updates to a finished call are ignored")
        void updateAfterEnd() {
            service.startCall("CA-6", null, "before", null, null, null);
            service.endCall("CA-6", CallStatus.MISSED, null, null, null);

            CallSession session = service.updateCall("CA-6", CallLifecycleEvent.builder().caller("after").build());

            assertThat(session.getCaller()).isEqualTo("before");
            assertThat(session.getStatus()).isEqualTo(CallStatus.MISSED);
        }
    }

    @Nested
    @DisplayName("transcript and interruptions")
    class Progress {

        @Test
        @DisplayName("transcript deltas are appended in order")
        void transcript() {
            service.startCall("CA-7", null, null, null, null, null);

            service.appendTranscript("CA-7", "Hello. ");
            service.appendTranscript("CA-7", "");
            CallSession session = service.appendTranscript("CA-7", "How are you?");

            assertThat(session.getTranscript()).isEqualTo("Hello. How are you?");
            verify(broadcaster, times(2)).publish(eq(DashboardEvent.TRANSCRIPT_UPDATED), eq("CA-7"), any());
        }

        @Test
        @DisplayName("interruptions increase by one each time")
        void interruptions() {
            service.startCall("CA-8", null, null, null, null, null);

            service.recordInterruption("CA-8");
            CallSession session = service.recordInterruption("CA-8");

            assertThat(session.getInterruptionCount()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("stuck call reclamation")
    class Reclaim {

        @Test
        @DisplayName("calls older than the threshold are failed and leave the active list")
        void reclaimsStale() {
            service.startCall(CallLifecycleEvent.builder()
                    .callId("CA-OLD")
                    .startTime(Instant.now().minusSeconds(2 * 3600))
                    .build());
            service.startCall("CA-NEW", null, null, null, null, null);

            List<CallSession> active = service.listActive();

            assertThat(active).extracting(CallSession::getCallId).containsExactly("CA-NEW");
            CallSession old = service.get("CA-OLD");
            assertThat(old.getStatus()).isEqualTo(CallStatus.FAILED);
            assertThat(old.getEndTime()).isNotNull();
            assertThat(old.getMetadata())
                    .containsEntry("cleanup_reason", CallSessionService.REASON_TIMEOUT)
                    .containsEntry("original_status", "in-progress");
            verify(broadcaster).publish(eq(DashboardEvent.CALL_RECLAIMED), eq("CA-OLD"), any());
        }

        @Test
        @DisplayName("manual cleanup tags its own reason and leaves finished calls alone")
        void manualCleanup() {
            service.startCall(CallLifecycleEvent.builder()
                    .callId("CA-DONE")
                    .startTime(Instant.now().minusSeconds(3 * 3600))
                    .metadata(Map.of("campaign", "q3"))
                    .build());
            service.endCall("CA-DONE", CallStatus.SUCCESS, null, null, null);
            service.startCall(CallLifecycleEvent.builder()
                    .callId("CA-STUCK")
                    .startTime(Instant.now().minusSeconds(3 * 3600))
                    .build());

            List<CallSession> reclaimed = service.cleanupStuck();

            assertThat(reclaimed).extracting(CallSession::getCallId).containsExactly("CA-STUCK");
            assertThat(reclaimed.get(0).getMetadata()).containsEntry("cleanup_reason", CallSessionService.REASON_MANUAL);
            assertThat(service.get("CA-DONE").getStatus()).isEqualTo(CallStatus.SUCCESS);
        }

        @Test
        @DisplayName("counters written after the call went stale survive the reclaim")
        void keepsLatestCounters() {
            service.startCall(CallLifecycleEvent.builder()
                    .callId("CA-BUSY")
                    .startTime(Instant.now().minusSeconds(2 * 3600))
                    .build());
            service.recordInterruption("CA-BUSY");
            service.recordInterruption("CA-BUSY");

            List<CallSession> reclaimed = service.reclaimStuck();

            assertThat(reclaimed).singleElement().satisfies(s -> {
                assertThat(s.getStatus()).isEqualTo(CallStatus.FAILED);
                assertThat(s.getInterruptionCount()).isEqualTo(2);
            });
            repository.flush();
            assertThat(service.get("CA-BUSY").getInterruptionCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("nothing stale means nothing is published")
        void nothingStale() {
            service.startCall("CA-FRESH", null, null, null, null, null);

            assertThat(service.reclaimStuck()).isEmpty();
            verify(broadcaster, never()).publish(eq(DashboardEvent.CALL_RECLAIMED), anyString(), any());
        }
    }

    @Test
    @DisplayName("purge removes the session row")
    void purge() {
        service.startCall("CA-9", null, null, null, null, null);

        service.purge("CA-9");

        assertThat(service.find("CA-9")).isEmpty();
        assertThatThrownBy(() -> service.purge("CA-9")).isInstanceOf(NotFoundException.class);
    }
}
