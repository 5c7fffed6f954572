package com.hello.chatrealtime.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hello.chatrealtime.dto.EventEnvelope;
import com.hello.chatrealtime.registry.ConnectionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * {@link ConnectionHandle} over a Spring WebSocket session. The session is expected
 * to be a {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}
 * because events for one user are sent from many handler threads.
 */
public class WebSocketConnectionHandle implements ConnectionHandle {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketConnectionHandle.class);

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketConnectionHandle(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String event, Object payload) {
        try {
            String json = objectMapper.writeValueAsString(new EventEnvelope(event, payload));
            session.sendMessage(new TextMessage(json));
        } catch (SessionLimitExceededException e) {
            // the decorator closes the session itself
            logger.warn("Dropping slow session {} while sending {}: {}", getId(), event, e.getMessage());
        } catch (IOException | IllegalStateException e) {
            logger.warn("Failed to send {} to session {}: {}", event, getId(), e.getMessage());
        }
    }

    @Override
    public void close(int code, String reason) {
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            logger.warn("Failed to close session {}: {}", getId(), e.getMessage());
        }
    }
}
