package com.walkierelay.server.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.walkierelay.server.lifecycle.ProcessTerminator;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class SignalingEndToEndTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @DynamicPropertySource
    static void mediaDir(DynamicPropertyRegistry registry) throws IOException {
        String dir = Files.createTempDirectory("walkie-media").toString();
        registry.add("walkie.media.dir", () -> dir);
    }

    @LocalServerPort
    private int port;

    @MockBean
    private ProcessTerminator terminator;

    private final OkHttpClient http = new OkHttpClient.Builder().build();
    private final List<Client> clients = new ArrayList<>();

    @AfterEach
    void tearDown() {
        for (Client c : clients) c.ws.close(1000, "done");
        http.dispatcher().executorService().shutdown();
    }

    private Client connect() throws InterruptedException {
        Client client = new Client();
        client.ws = http.newWebSocket(new Request.Builder().url("ws://localhost:" + port + "/ws").build(), client);
        clients.add(client);
        JsonNode connected = client.await("connected");
        assertTrue(connected.path("data").path("socketId").isTextual());
        return client;
    }

    @Test
    void joinTalkAndLeave() throws Exception {
        Client a = connect();
        Client b = connect();

        a.send("join-channel", "{\"channelId\":\"room1\",\"userId\":\"userA\"}");
        assertEquals(0, a.await("channel-users").path("data").size());

        b.send("join-channel", "{\"channelId\":\"room1\",\"userId\":\"userB\"}");
        JsonNode others = b.await("channel-users").path("data");
        assertEquals(1, others.size());
        assertEquals("userA", others.get(0).asText());
        assertEquals("userB", a.await("user-joined").path("data").asText());

        a.send("transmission-start", "{\"channelId\":\"room1\",\"userId\":\"userA\",\"timestamp\":42}");
        JsonNode start = b.await("transmission-start").path("data");
        assertEquals("userA", start.path("userId").asText());
        assertEquals(42, start.path("timestamp").asLong());

        b.ws.close(1000, "bye");
        assertEquals("userB", a.await("user-left").path("data").asText());
    }

    @Test
    void malformedFramesGetAnErrorAndTheConnectionSurvives() throws Exception {
        Client a = connect();

        a.ws.send("not json");
        assertEquals("malformed-message", a.await("error").path("data").path("code").asText());

        a.send("ping", "{}");
        assertTrue(a.await("pong").path("data").path("timestamp").isNumber());
    }

    static class Client extends WebSocketListener {
        final BlockingQueue<JsonNode> inbox = new LinkedBlockingQueue<>();
        WebSocket ws;

        void send(String event, String dataJson) {
            ws.send("{\"event\":\"" + event + "\",\"data\":" + dataJson + "}");
        }

        JsonNode await(String event) throws InterruptedException {
            long deadline = System.currentTimeMillis() + 5000;
            while (true) {
                long left = deadline - System.currentTimeMillis();
                JsonNode next = left > 0 ? inbox.poll(left, TimeUnit.MILLISECONDS) : null;
                if (next == null) fail("no " + event + " within 5s");
                if (event.equals(next.path("event").asText())) return next;
            }
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            try {
                inbox.add(MAPPER.readTree(text));
            } catch (IOException e) {
                fail("server sent invalid JSON: " + text);
            }
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            t.printStackTrace();
        }
    }
}
