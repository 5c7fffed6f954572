package com.hello.chatrealtime.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hello.chatrealtime.config.WebSocketHandshakeInterceptor;
import com.hello.chatrealtime.dto.ErrorEvent;
import com.hello.chatrealtime.dto.EventEnvelope;
import com.hello.chatrealtime.registry.Connection;
import com.hello.chatrealtime.service.ConnectionLifecycleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Transport edge of the real-time service. The handshake interceptor has already
 * authenticated the user; this handler registers the connection, feeds each
 * inbound frame to the dispatcher in arrival order, and runs the disconnect
 * teardown when the transport closes.
 */
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    static final String CONNECTION_ATTRIBUTE = "connection";

    private static final Logger logger = LoggerFactory.getLogger(ChatWebSocketHandler.class);

    private final ConnectionLifecycleService lifecycleService;
    private final ChatEventDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final int sendTimeLimitMs;
    private final int sendBufferSizeLimit;

    public ChatWebSocketHandler(ConnectionLifecycleService lifecycleService,
            ChatEventDispatcher dispatcher,
            ObjectMapper objectMapper,
            @Value("${chat.websocket.send-time-limit-ms:10000}") int sendTimeLimitMs,
            @Value("${chat.websocket.send-buffer-size-limit:524288}") int sendBufferSizeLimit) {
        this.lifecycleService = lifecycleService;
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws Exception {
        String userId = (String) session.getAttributes().get(WebSocketHandshakeInterceptor.USER_ID_ATTRIBUTE);
        if (userId == null) {
            // handshake interceptor should have refused this upgrade
            logger.warn("Session {} opened without an authenticated user", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Authentication required"));
            return;
        }

        WebSocketSession concurrentSession =
                new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferSizeLimit);
        Connection connection = lifecycleService.onConnect(userId,
                new WebSocketConnectionHandle(concurrentSession, objectMapper));
        session.getAttributes().put(CONNECTION_ATTRIBUTE, connection);
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        Connection connection = connectionOf(session);
        if (connection == null) {
            return;
        }
        if (connection.isSuperseded() || connection.isClosed()) {
            logger.debug("Ignoring frame on stale connection {}", connection);
            return;
        }

        EventEnvelope.Inbound envelope;
        try {
            envelope = objectMapper.readValue(message.getPayload(), EventEnvelope.Inbound.class);
        } catch (JsonProcessingException e) {
            connection.send(ChatEventDispatcher.ERROR, new ErrorEvent("Malformed event"));
            return;
        }
        if (envelope.getEvent() == null || envelope.getEvent().isBlank()) {
            connection.send(ChatEventDispatcher.ERROR, new ErrorEvent("Event name is required"));
            return;
        }

        dispatcher.dispatch(connection, envelope.getEvent(), envelope.getData());
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception)
            throws Exception {
        logger.warn("Transport error on session {}: {}", session.getId(), exception.getMessage());
        if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        Connection connection = connectionOf(session);
        if (connection != null) {
            logger.debug("Session {} closed with {}", session.getId(), status);
            lifecycleService.onDisconnect(connection);
        }
    }

    private static Connection connectionOf(WebSocketSession session) {
        return (Connection) session.getAttributes().get(CONNECTION_ATTRIBUTE);
    }
}
