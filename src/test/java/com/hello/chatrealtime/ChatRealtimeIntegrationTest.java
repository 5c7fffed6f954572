package com.hello.chatrealtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hello.chatrealtime.entity.ChannelMember;
import com.hello.chatrealtime.entity.Message;
import com.hello.chatrealtime.entity.User;
import com.hello.chatrealtime.model.MessageStatus;
import com.hello.chatrealtime.model.RoomKey;
import com.hello.chatrealtime.repository.ChannelMemberRepository;
import com.hello.chatrealtime.repository.MessageRepository;
import com.hello.chatrealtime.repository.UserRepository;
import com.hello.chatrealtime.security.JwtTokenProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "chat.jwt.secret=integration-secret-integration-secret-1")
class ChatRealtimeIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JwtTokenProvider tokenProvider;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private ChannelMemberRepository channelMemberRepository;

    @Autowired
    private MessageRepository messageRepository;

    private final List<WebSocketSession> sessions = new ArrayList<>();

    private User alice;
    private User bob;
    private String channelId;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString();
        alice = userRepository.save(new User("alice-" + suffix + "@example.com", "Alice"));
        bob = userRepository.save(new User("bob-" + suffix + "@example.com", "Bob"));
        channelId = UUID.randomUUID().toString();
        channelMemberRepository.save(new ChannelMember(channelId, alice.getId()));
        channelMemberRepository.save(new ChannelMember(channelId, bob.getId()));
    }

    @AfterEach
    void tearDown() throws Exception {
        for (WebSocketSession session : sessions) {
            if (session.isOpen()) {
                session.close();
            }
        }
    }

    /**
     * Test-side client that queues every inbound envelope.
     */
    private final class RecordingClient extends TextWebSocketHandler {
        private final BlockingQueue<JsonNode> inbox = new LinkedBlockingQueue<>();
        private final BlockingQueue<CloseStatus> closed = new LinkedBlockingQueue<>();
        private WebSocketSession session;

        @Override
        protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message)
                throws Exception {
            inbox.add(objectMapper.readTree(message.getPayload()));
        }

        @Override
        public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
            closed.add(status);
        }

        void send(String event, Map<String, Object> data) throws Exception {
            String json = objectMapper.writeValueAsString(Map.of("event", event, "data", data));
            session.sendMessage(new TextMessage(json));
        }

        /**
         * Waits for the next envelope named {@code event}, skipping any other.
         */
        JsonNode await(String event) throws InterruptedException {
            return await(event, data -> true);
        }

        JsonNode await(String event, Predicate<JsonNode> matching) throws InterruptedException {
            long deadline = System.nanoTime() + TIMEOUT.toNanos();
            while (System.nanoTime() < deadline) {
                JsonNode envelope = inbox.poll(50, TimeUnit.MILLISECONDS);
                if (envelope != null && event.equals(envelope.get("event").asText())
                        && matching.test(envelope.get("data"))) {
                    return envelope.get("data");
                }
            }
            throw new AssertionError("No " + event + " received within " + TIMEOUT);
        }
    }

    private RecordingClient connect(User user) throws Exception {
        RecordingClient client = new RecordingClient();
        String token = tokenProvider.generateToken(user.getId(), user.getEmail());
        client.session = new StandardWebSocketClient()
                .execute(client, "ws://localhost:" + port + "/ws?token=" + token)
                .get(TIMEOUT.toSeconds(), TimeUnit.SECONDS);
        sessions.add(client.session);
        client.await("user_presence", data -> user.getId().equals(data.get("userId").asText()));
        return client;
    }

    @Test
    void handshakeWithoutValidTokenIsRefused() {
        assertThatThrownBy(() -> new StandardWebSocketClient()
                .execute(new RecordingClient(), "ws://localhost:" + port + "/ws?token=bogus")
                .get(TIMEOUT.toSeconds(), TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class);
        assertThatThrownBy(() -> new StandardWebSocketClient()
                .execute(new RecordingClient(), "ws://localhost:" + port + "/ws")
                .get(TIMEOUT.toSeconds(), TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class);
    }

    @Test
    void messageIsRelayedDeliveredAndRead() throws Exception {
        RecordingClient aliceClient = connect(alice);
        RecordingClient bobClient = connect(bob);

        aliceClient.send("join_channel", Map.of("channelId", channelId));
        aliceClient.await("joined_channel");
        bobClient.send("join_channel", Map.of("channelId", channelId));
        bobClient.await("joined_channel");
        assertThat(aliceClient.await("user_joined").get("userId").asText()).isEqualTo(bob.getId());

        Message stored = messageRepository.save(new Message(RoomKey.channel(channelId), bob.getId(), "hi"));
        bobClient.send("new_message", Map.of("channelId", channelId,
                "message", Map.of("id", stored.getId(), "text", "hi")));

        JsonNode relayed = aliceClient.await("new_message");
        assertThat(relayed.get("message").get("text").asText()).isEqualTo("hi");
        assertThat(relayed.get("message").get("status").asText()).isEqualTo("sent");
        JsonNode delivered = bobClient.await("message_status_update");
        assertThat(delivered.get("messageId").asText()).isEqualTo(stored.getId());
        assertThat(delivered.get("status").asText()).isEqualTo("delivered");

        aliceClient.send("messages_read", Map.of("channelId", channelId, "messageIds", List.of(stored.getId())));
        JsonNode read = bobClient.await("message_status_update");
        assertThat(read.get("status").asText()).isEqualTo("read");
        assertThat(messageRepository.findById(stored.getId()))
                .hasValueSatisfying(m -> assertThat(m.getStatus()).isEqualTo(MessageStatus.READ));
    }

    @Test
    void disconnectIsAnnouncedAndPresenceEndpointFollows() throws Exception {
        RecordingClient aliceClient = connect(alice);
        RecordingClient bobClient = connect(bob);

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(tokenProvider.generateToken(alice.getId(), alice.getEmail()));
        String url = "/api/presence/users/" + bob.getId();
        ResponseEntity<JsonNode> online = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers),
                JsonNode.class);
        assertThat(online.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(online.getBody().get("online").asBoolean()).isTrue();

        bobClient.session.close();

        JsonNode offline = aliceClient.await("user_presence",
                data -> bob.getId().equals(data.get("userId").asText())
                        && "offline".equals(data.get("status").asText()));
        assertThat(offline.get("userId").asText()).isEqualTo(bob.getId());
        assertThat(offline.get("status").asText()).isEqualTo("offline");
        ResponseEntity<JsonNode> after = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers),
                JsonNode.class);
        assertThat(after.getBody().get("online").asBoolean()).isFalse();
    }

    @Test
    void reconnectClosesPreviousConnection() throws Exception {
        RecordingClient first = connect(alice);
        RecordingClient second = connect(alice);

        CloseStatus status = first.closed.poll(TIMEOUT.toSeconds(), TimeUnit.SECONDS);
        assertThat(status).isNotNull();
        assertThat(status.getCode()).isEqualTo(4001);
        assertThat(second.session.isOpen()).isTrue();
    }

    @Test
    void presenceApiRequiresToken() {
        ResponseEntity<String> response = restTemplate.getForEntity("/api/presence/users/" + alice.getId(),
                String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
    }

    @Test
    void healthIsOpen() {
        ResponseEntity<JsonNode> response = restTemplate.getForEntity("/health", JsonNode.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().get("status").asText()).isEqualTo("ok");
    }
}
