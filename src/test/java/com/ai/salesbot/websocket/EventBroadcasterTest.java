package com.ai.salesbot.websocket;

import com.ai.salesbot.dto.DashboardEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("EventBroadcaster")
class EventBroadcasterTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    private EventBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        broadcaster = new EventBroadcaster(mapper, Runnable::run, 5000, 512 * 1024, 256);
    }

    @Test
    @DisplayName("subscribers that never joined a group receive no broadcasts")
    void notJoined() throws IOException {
        WebSocketSession session = openSession("s1");
        broadcaster.register(session);

        broadcaster.publish(DashboardEvent.CALL_STARTED, "CA-1", Map.of("a", 1));

        verify(session, never()).sendMessage(any());
        assertThat(broadcaster.subscriberCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("joined subscribers receive the serialized event")
    void delivers() throws Exception {
        WebSocketSession session = openSession("s1");
        broadcaster.register(session);
        broadcaster.join("s1", "admin");

        broadcaster.publish(DashboardEvent.CALL_ENDED, "CA-2", Map.of("status", "success"));

        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(captor.capture());
        JsonNode frame = mapper.readTree(captor.getValue().getPayload());
        assertThat(frame.path("event").asText()).isEqualTo("call-ended");
        assertThat(frame.path("callId").asText()).isEqualTo("CA-2");
        assertThat(frame.path("data").path("status").asText()).isEqualTo("success");
        assertThat(frame.has("timestamp")).isTrue();
    }

    @Test
    @DisplayName("a target role limits delivery to its members")
    void targetRole() throws IOException {
        WebSocketSession admin = openSession("admin");
        WebSocketSession viewer = openSession("viewer");
        broadcaster.register(admin);
        broadcaster.register(viewer);
        broadcaster.join("admin", "Admin");
        broadcaster.join("viewer", null);

        broadcaster.publish(DashboardEvent.of(DashboardEvent.SYSTEM_HEALTH, null, Map.of()), "admin");

        verify(admin).sendMessage(any());
        verify(viewer, never()).sendMessage(any());
    }

    @Test
    @DisplayName("leaving the last group stops broadcasts")
    void leave() throws IOException {
        WebSocketSession session = openSession("s1");
        broadcaster.register(session);
        broadcaster.join("s1", "viewer");
        broadcaster.leave("s1", "viewer");

        broadcaster.publish(DashboardEvent.CALL_UPDATED, "CA-3", Map.of());

        verify(session, never()).sendMessage(any());
    }

    @Test
    @DisplayName("direct sends reach a subscriber regardless of groups")
    void sendTo() throws IOException {
        WebSocketSession session = openSession("s1");
        broadcaster.register(session);

        broadcaster.sendTo("s1", DashboardEvent.of(DashboardEvent.STATE_SNAPSHOT, null, Map.of("activeCount", 0)));

        verify(session).sendMessage(any());
    }

    @Test
    @DisplayName("a failing subscriber is dropped and closed without affecting others")
    void failingSubscriber() throws IOException {
        WebSocketSession broken = openSession("broken");
        WebSocketSession healthy = openSession("healthy");
        doThrow(new IOException("pipe closed")).when(broken).sendMessage(any());
        broadcaster.register(broken);
        broadcaster.register(healthy);
        broadcaster.join("broken", "viewer");
        broadcaster.join("healthy", "viewer");

        broadcaster.publish(DashboardEvent.CALL_STARTED, "CA-4", Map.of());
        broadcaster.publish(DashboardEvent.CALL_UPDATED, "CA-4", Map.of());

        verify(broken).close(CloseStatus.SESSION_NOT_RELIABLE);
        verify(healthy, times(2)).sendMessage(any());
        assertThat(broadcaster.subscriberCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("closed sessions are pruned on the next delivery")
    void closedSession() throws IOException {
        WebSocketSession session = openSession("s1");
        broadcaster.register(session);
        broadcaster.join("s1", "viewer");
        when(session.isOpen()).thenReturn(false);

        broadcaster.publish(DashboardEvent.CALL_STARTED, "CA-5", Map.of());

        verify(session, never()).sendMessage(any());
        assertThat(broadcaster.subscriberCount()).isZero();
    }

    @Nested
    @DisplayName("inside a transaction")
    class InsideTransaction {

        @BeforeEach
        void begin() {
            TransactionSynchronizationManager.initSynchronization();
        }

        @AfterEach
        void end() {
            TransactionSynchronizationManager.clearSynchronization();
        }

        @Test
        @DisplayName("events are held until commit")
        void heldUntilCommit() throws IOException {
            WebSocketSession session = joined("s1");

            broadcaster.publish(DashboardEvent.CALL_TERMINATED, "CA-8", Map.of());
            verify(session, never()).sendMessage(any());

            TransactionSynchronizationManager.getSynchronizations().forEach(TransactionSynchronization::afterCommit);
            verify(session).sendMessage(any());
        }

        @Test
        @DisplayName("events are discarded on rollback")
        void discardedOnRollback() throws IOException {
            WebSocketSession session = joined("s1");

            broadcaster.publish(DashboardEvent.QUALIFICATION_UPDATED, "CA-9", Map.of());
            TransactionSynchronizationManager.getSynchronizations()
                    .forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));

            verify(session, never()).sendMessage(any());
        }

        private WebSocketSession joined(String id) {
            WebSocketSession session = openSession(id);
            broadcaster.register(session);
            broadcaster.join(id, "viewer");
            return session;
        }
    }

    @Nested
    @DisplayName("with a stalled subscriber")
    class Stalled {

        private final CountDownLatch release = new CountDownLatch(1);
        private ExecutorService pool;

        @BeforeEach
        void startPool() {
            pool = Executors.newFixedThreadPool(2);
        }

        @AfterEach
        void stopPool() {
            release.countDown();
            pool.shutdownNow();
        }

        @Test
        @DisplayName("healthy subscribers keep receiving and the stalled one is dropped past the send limit")
        void stalledDoesNotBlockOthers() throws Exception {
            EventBroadcaster pooled = new EventBroadcaster(mapper, pool, 200, 512 * 1024, 256);
            WebSocketSession slow = blockingSession("slow");
            WebSocketSession healthy = openSession("healthy");
            CountDownLatch received = new CountDownLatch(2);
            doAnswer(inv -> {
                received.countDown();
                return null;
            }).when(healthy).sendMessage(any());
            pooled.register(slow);
            pooled.register(healthy);
            pooled.join("slow", "viewer");
            pooled.join("healthy", "viewer");

            pooled.publish(DashboardEvent.CALL_STARTED, "CA-6", Map.of());
            pooled.publish(DashboardEvent.CALL_UPDATED, "CA-6", Map.of());

            assertThat(received.await(1, TimeUnit.SECONDS)).isTrue();

            Thread.sleep(400);
            pooled.publish(DashboardEvent.CALL_ENDED, "CA-6", Map.of());

            verify(slow).close(CloseStatus.SESSION_NOT_RELIABLE);
            assertThat(pooled.subscriberCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("a lane that backs up past the pending limit is dropped")
        void backlog() throws Exception {
            EventBroadcaster pooled = new EventBroadcaster(mapper, pool, 60_000, 512 * 1024, 2);
            WebSocketSession slow = blockingSession("slow");
            pooled.register(slow);
            pooled.join("slow", "viewer");

            for (int i = 0; i < 5; i++) {
                pooled.publish(DashboardEvent.CALL_UPDATED, "CA-7", Map.of("seq", i));
            }

            verify(slow).close(CloseStatus.SESSION_NOT_RELIABLE);
            assertThat(pooled.subscriberCount()).isZero();
        }

        private WebSocketSession blockingSession(String id) throws IOException {
            WebSocketSession session = openSession(id);
            doAnswer(inv -> {
                release.await(5, TimeUnit.SECONDS);
                return null;
            }).when(session).sendMessage(any());
            return session;
        }
    }

    private static WebSocketSession openSession(String id) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        return session;
    }
}
