package com.realtime.messenger.live;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.realtime.messenger.security.JwtProvider;
import com.realtime.messenger.support.TestUsers;
import com.realtime.messenger.user.entity.User;
import com.realtime.messenger.user.repository.UserRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class LiveMessagingEndToEndTest {

    private static final long WAIT_MS = 5000;

    @LocalServerPort int port;
    @Autowired TestRestTemplate rest;
    @Autowired ObjectMapper objectMapper;
    @Autowired UserRepository userRepository;
    @Autowired JwtProvider jwtProvider;

    private final List<WebSocketSession> opened = new ArrayList<>();

    @AfterEach
    void closeSockets() throws Exception {
        for (WebSocketSession s : opened) {
            if (s.isOpen()) s.close();
        }
    }

    @Test
    void 전송_수신_읽음_대화목록() throws Exception {
        User alice = TestUsers.create(userRepository, "alice");
        User bob = TestUsers.create(userRepository, "bob");

        Client bobClient = connect();
        bobClient.join(bob);
        Client aliceClient = connect();
        aliceClient.join(alice);

        // A -> B 전송 (durable)
        ResponseEntity<String> sent = http(HttpMethod.POST, "/api/messages", alice,
                Map.of("receiver", bob.getId().toString(), "text", "hi", "messageType", "text"));
        assertThat(sent.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        JsonNode message = objectMapper.readTree(sent.getBody());
        String id = message.get("id").asText();
        assertThat(message.get("isRead").asBoolean()).isFalse();

        JsonNode incoming = bobClient.await("newMessage", d -> id.equals(d.path("id").asText()));
        assertThat(incoming.get("text").asText()).isEqualTo("hi");
        assertThat(incoming.at("/sender/id").asText()).isEqualTo(alice.getId().toString());

        // B 가 읽음 -> A 에게 messageReadUpdate
        ResponseEntity<String> read = http(HttpMethod.PUT, "/api/messages/" + id + "/read", bob, null);
        assertThat(read.getStatusCode()).isEqualTo(HttpStatus.OK);

        JsonNode receipt = aliceClient.await("messageReadUpdate", d -> id.equals(d.path("messageId").asText()));
        assertThat(receipt.get("readAt").isNull()).isFalse();
        assertThat(receipt.get("readerId").asText()).isEqualTo(bob.getId().toString());

        ResponseEntity<String> chats = http(HttpMethod.GET, "/api/messages/chats", alice, null);
        JsonNode list = objectMapper.readTree(chats.getBody());
        assertThat(list).hasSize(1);
        assertThat(list.get(0).at("/user/id").asText()).isEqualTo(bob.getId().toString());
        assertThat(list.get(0).get("unreadCount").asLong()).isZero();
    }

    @Test
    void live_전송과_타이핑() throws Exception {
        User alice = TestUsers.create(userRepository, "alice");
        User bob = TestUsers.create(userRepository, "bob");

        Client aliceClient = connect();
        // join 전에는 거부
        aliceClient.send("typing", Map.of("sender", alice.getId().toString(), "receiver", bob.getId().toString()));
        JsonNode rejected = aliceClient.await("messageError", d -> true);
        assertThat(rejected.get("kind").asText()).isEqualTo("FORBIDDEN");

        aliceClient.join(alice);
        Client bobClient = connect();
        bobClient.join(bob);

        aliceClient.send("sendMessage", Map.of(
                "sender", alice.getId().toString(),
                "receiver", bob.getId().toString(),
                "text", "over the socket",
                "messageType", "text"));
        JsonNode atBob = bobClient.await("newMessage", d -> "over the socket".equals(d.path("text").asText()));
        JsonNode echo = aliceClient.await("newMessage", d -> "over the socket".equals(d.path("text").asText()));
        assertThat(echo.get("id").asText()).isEqualTo(atBob.get("id").asText());

        // 다른 사람 행세는 거부
        aliceClient.send("sendMessage", Map.of(
                "sender", bob.getId().toString(),
                "receiver", alice.getId().toString(),
                "text", "spoofed"));
        assertThat(aliceClient.await("messageError", d -> "sendMessage".equals(d.path("event").asText()))
                .get("kind").asText()).isEqualTo("FORBIDDEN");

        aliceClient.send("typing", Map.of("sender", alice.getId().toString(), "receiver", bob.getId().toString()));
        JsonNode typing = bobClient.await("userTyping", d -> true);
        assertThat(typing.get("sender").asText()).isEqualTo(alice.getId().toString());

        // B 가 live 경로로 읽음 처리
        bobClient.send("messageRead", Map.of("messageId", atBob.get("id").asText(), "readerId", bob.getId().toString()));
        aliceClient.await("messageReadUpdate", d -> atBob.get("id").asText().equals(d.path("messageId").asText()));
    }

    @Test
    void 차단한_상대에게는_타이핑도_가지_않는다() throws Exception {
        User alice = TestUsers.create(userRepository, "alice");
        User bob = TestUsers.createBlocking(userRepository, "bob", alice.getId());

        Client aliceClient = connect();
        aliceClient.join(alice);

        aliceClient.send("typing", Map.of("sender", alice.getId().toString(), "receiver", bob.getId().toString()));
        assertThat(aliceClient.await("messageError", d -> true).get("kind").asText()).isEqualTo("FORBIDDEN");

        ResponseEntity<String> sent = http(HttpMethod.POST, "/api/messages", alice,
                Map.of("receiver", bob.getId().toString(), "text", "hello?"));
        assertThat(sent.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    }

    @Test
    void 접속과_종료가_다른_사용자에게_알려진다() throws Exception {
        User alice = TestUsers.create(userRepository, "alice");
        User bob = TestUsers.create(userRepository, "bob");

        Client bobClient = connect();
        bobClient.join(bob);

        Client aliceClient = connect();
        aliceClient.join(alice);
        String aliceId = alice.getId().toString();
        bobClient.await("userStatusUpdate", d -> aliceId.equals(d.path("userId").asText())
                && "online".equals(d.path("status").asText()));

        aliceClient.session.close();
        JsonNode offline = bobClient.await("userStatusUpdate", d -> aliceId.equals(d.path("userId").asText())
                && "offline".equals(d.path("status").asText()));
        assertThat(offline.get("lastSeen").isNull()).isFalse();

        ResponseEntity<String> presence = http(HttpMethod.GET, "/api/presence/" + aliceId, bob, null);
        assertThat(objectMapper.readTree(presence.getBody()).get("status").asText()).isEqualTo("offline");
    }

    // ── helpers ──────────────────────────────────────────────────────

    private ResponseEntity<String> http(HttpMethod method, String path, User as, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(jwtProvider.createAccessToken(as));
        headers.setContentType(MediaType.APPLICATION_JSON);
        return rest.exchange(path, method, new HttpEntity<>(body, headers), String.class);
    }

    private Client connect() throws Exception {
        Client client = new Client();
        client.session = new StandardWebSocketClient()
                .execute(client, "ws://localhost:" + port + "/ws/live")
                .get(WAIT_MS, TimeUnit.MILLISECONDS);
        opened.add(client.session);
        return client;
    }

    private class Client extends TextWebSocketHandler {
        final BlockingQueue<JsonNode> frames = new LinkedBlockingQueue<>();
        WebSocketSession session;

        @Override
        protected void handleTextMessage(WebSocketSession s, TextMessage message) throws Exception {
            frames.add(objectMapper.readTree(message.getPayload()));
        }

        void send(String event, Object data) throws Exception {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(Map.of("event", event, "data", data))));
        }

        void join(User user) throws Exception {
            send("join", Map.of("userId", user.getId().toString()));
            await("joined", d -> user.getId().toString().equals(d.path("userId").asText()));
        }

        /** 조건에 맞는 이벤트가 올 때까지 다른 이벤트는 건너뛴다 */
        JsonNode await(String event, Predicate<JsonNode> match) throws InterruptedException {
            long deadline = System.currentTimeMillis() + WAIT_MS;
            while (true) {
                long left = deadline - System.currentTimeMillis();
                JsonNode frame = left > 0 ? frames.poll(left, TimeUnit.MILLISECONDS) : null;
                if (frame == null) {
                    fail("no " + event + " within " + WAIT_MS + "ms");
                }
                if (event.equals(frame.path("event").asText()) && match.test(frame.path("data"))) {
                    return frame.path("data");
                }
            }
        }
    }
}
