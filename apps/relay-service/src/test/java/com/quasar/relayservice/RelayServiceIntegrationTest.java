package com.quasar.relayservice;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "quasar.tick.enabled=false")
class RelayServiceIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate rest;

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<WebSocketSession> sessions = new ArrayList<>();

    @AfterEach
    void closeSessions() throws Exception {
        for (WebSocketSession session : sessions) {
            if (session.isOpen()) {
                session.close();
            }
        }
    }

    private WebSocketSession connect(String query, BlockingQueue<JsonNode> inbox) throws Exception {
        TextWebSocketHandler handler = new TextWebSocketHandler() {
            @Override
            protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
                inbox.add(mapper.readTree(message.getPayload()));
            }
        };
        WebSocketSession session = new StandardWebSocketClient()
                .execute(handler, "ws://localhost:" + port + "/ws" + query)
                .get(5, TimeUnit.SECONDS);
        sessions.add(session);
        return session;
    }

    private JsonNode next(BlockingQueue<JsonNode> inbox, String type) throws InterruptedException {
        while (true) {
            JsonNode message = inbox.poll(5, TimeUnit.SECONDS);
            assertThat(message).as("waiting for %s", type).isNotNull();
            if (type.equals(message.path("t").asText())) {
                return message;
            }
        }
    }

    @Test
    void sourceFramesReachViewerAndPingIsAnswered() throws Exception {
        BlockingQueue<JsonNode> viewerInbox = new LinkedBlockingQueue<>();
        WebSocketSession viewer = connect("", viewerInbox);
        assertThat(next(viewerInbox, "sync").path("snd").path("mode").asText()).isNotEmpty();

        WebSocketSession source = connect("?role=game", new LinkedBlockingQueue<>());
        source.sendMessage(new TextMessage("{\"t\":\"register\",\"gameType\":\"trax\"}"));
        source.sendMessage(new TextMessage("{\"t\":\"frame\",\"seq\":1,\"display\":\"hello\"}"));

        JsonNode frame = next(viewerInbox, "frame");
        assertThat(frame.path("seq").asLong()).isEqualTo(1);
        assertThat(frame.path("display").asText()).isEqualTo("hello");
        assertThat(frame.has("serverTs")).isTrue();

        viewer.sendMessage(new TextMessage("{\"t\":\"ping\",\"ts\":123456}"));
        JsonNode pong = next(viewerInbox, "pong");
        assertThat(pong.path("clientTs").asLong()).isEqualTo(123456);
        assertThat(pong.path("lastSeq").asLong()).isEqualTo(1);

        viewer.sendMessage(new TextMessage("{\"t\":\"bridge.spawn\",\"game\":\"no-such-game\"}"));
        assertThat(next(viewerInbox, "bridge.error").path("error").asText()).isEqualTo("Unknown game");

        viewer.sendMessage(new TextMessage("{\"t\":\"bridge.spawn\",\"game\":\"pong\",\"channel\":1}"));
        assertThat(next(viewerInbox, "bridge.ready").path("status").asText()).isEqualTo("builtin");
    }

    @Test
    void statusEndpointsRespond() {
        ResponseEntity<JsonNode> status = rest.getForEntity("/api/status", JsonNode.class);
        assertThat(status.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(status.getBody().path("code").asInt()).isEqualTo(200);
        assertThat(status.getBody().path("data").path("status").asText()).isEqualTo("ok");
        assertThat(status.getBody().path("data").path("masterTick").path("enabled").asBoolean()).isFalse();

        ResponseEntity<String> screen = rest.getForEntity("/api/screen", String.class);
        assertThat(screen.getStatusCode()).isEqualTo(HttpStatus.OK);

        ResponseEntity<JsonNode> games = rest.getForEntity("/api/games", JsonNode.class);
        assertThat(games.getBody().path("data").findValuesAsText("name")).contains("magnetar", "pong");
    }

    @Test
    void controlEndpointsValidateInput() {
        ResponseEntity<JsonNode> badFps = rest.postForEntity("/api/tick/fps?fps=0", null, JsonNode.class);
        assertThat(badFps.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(badFps.getBody().path("code").asInt()).isEqualTo(400);

        ResponseEntity<JsonNode> fps = rest.postForEntity("/api/tick/fps?fps=30", null, JsonNode.class);
        assertThat(fps.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(fps.getBody().path("data").path("interval").asLong()).isEqualTo(33);

        ResponseEntity<JsonNode> noSlot = rest.exchange("/api/slots/9", HttpMethod.DELETE,
                null, JsonNode.class);
        assertThat(noSlot.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);

        ResponseEntity<JsonNode> noBridge = rest.exchange("/api/bridges/trax/1", HttpMethod.DELETE,
                null, JsonNode.class);
        assertThat(noBridge.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }
}
