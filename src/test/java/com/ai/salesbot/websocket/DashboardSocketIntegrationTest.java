package com.ai.salesbot.websocket;

import com.ai.salesbot.auth.SalesBotApplication;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.handshake.ServerHandshake;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;

import java.net.URI;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = SalesBotApplication.class, webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@DisplayName("Dashboard socket end to end")
class DashboardSocketIntegrationTest {

    private static final long WAIT_SECONDS = 5;

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate rest;

    @Autowired
    private ObjectMapper mapper;

    private RecordingClient client;

    @BeforeEach
    void connect() throws Exception {
        client = new RecordingClient(URI.create("ws://localhost:" + port + "/ws/dashboard"));
        assertThat(client.connectBlocking(WAIT_SECONDS, TimeUnit.SECONDS)).isTrue();
    }

    @AfterEach
    void disconnect() throws InterruptedException {
        client.closeBlocking();
    }

    @Test
    @DisplayName("joining returns a snapshot and lifecycle frames are broadcast back")
    void joinThenLifecycle() throws Exception {
        client.send("{\"event\":\"join-room\",\"role\":\"admin\"}");

        JsonNode snapshot = awaitEvent("state-snapshot");
        assertThat(snapshot.path("data").path("role").asText()).isEqualTo("admin");
        assertThat(snapshot.path("data").has("activeCalls")).isTrue();

        client.send("{\"event\":\"call-started\",\"data\":{\"callId\":\"CA-WS-1\",\"caller\":\"+911234\","
                + "\"type\":\"inbound\",\"language\":\"hi\"}}");

        JsonNode started = awaitEvent("call-started");
        assertThat(started.path("callId").asText()).isEqualTo("CA-WS-1");
        assertThat(started.path("data").path("status").asText()).isEqualTo("in-progress");
        assertThat(started.path("data").path("direction").asText()).isEqualTo("inbound");

        client.send("{\"event\":\"transcript\",\"callId\":\"CA-WS-1\",\"transcript\":\"Hello\"}");
        JsonNode transcript = awaitEvent("transcript-updated");
        assertThat(transcript.path("data").path("transcript").asText()).isEqualTo("Hello");

        rest.postForEntity("/api/calls/CA-WS-1/terminate", null, JsonNode.class);
        JsonNode terminated = awaitEvent("call-terminated");
        assertThat(terminated.path("data").path("status").asText()).isEqualTo("failed");

        JsonNode call = rest.getForObject("/api/calls/CA-WS-1", JsonNode.class);
        assertThat(call.path("data").path("status").asText()).isEqualTo("failed");
        assertThat(call.path("data").path("metadata").path("terminated_by").asText()).isEqualTo("operator");
    }

    @Test
    @DisplayName("unknown events and frames for unknown calls are answered with an error")
    void errors() throws Exception {
        client.send("{\"event\":\"dance\"}");
        assertThat(awaitEvent("error").path("data").path("message").asText()).contains("dance");

        client.send("{\"event\":\"call-updated\",\"callId\":\"CA-NOPE\",\"caller\":\"x\"}");
        JsonNode error = awaitEvent("error");
        assertThat(error.path("callId").asText()).isEqualTo("CA-NOPE");
    }

    private JsonNode awaitEvent(String event) throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(WAIT_SECONDS);
        while (System.nanoTime() < deadline) {
            String raw = client.messages.poll(100, TimeUnit.MILLISECONDS);
            if (raw == null) continue;
            JsonNode frame = mapper.readTree(raw);
            if (event.equals(frame.path("event").asText())) {
                return frame;
            }
        }
        throw new AssertionError("No '" + event + "' frame within " + WAIT_SECONDS + "s");
    }

    static class RecordingClient extends WebSocketClient {

        final BlockingQueue<String> messages = new LinkedBlockingQueue<>();

        RecordingClient(URI uri) {
            super(uri);
        }

        @Override
        public void onOpen(ServerHandshake handshake) {
        }

        @Override
        public void onMessage(String message) {
            messages.add(message);
        }

        @Override
        public void onClose(int code, String reason, boolean remote) {
        }

        @Override
        public void onError(Exception ex) {
            messages.add("{\"event\":\"client-error\",\"data\":{\"message\":\"" + ex.getMessage() + "\"}}");
        }
    }
}
