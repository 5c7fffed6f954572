package com.hello.chatrealtime.config;

import com.hello.chatrealtime.controller.ChatWebSocketHandler;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the raw WebSocket endpoint. Frames are JSON envelopes with an event
 * name and a data object; routing by event name happens in the dispatcher, so no
 * STOMP broker is involved.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    @Autowired
    private ChatWebSocketHandler chatWebSocketHandler;

    @Autowired
    private WebSocketHandshakeInterceptor handshakeInterceptor;

    @Value("${chat.websocket.path:/ws}")
    private String path;

    @Value("${chat.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(chatWebSocketHandler, path)
                .setAllowedOriginPatterns(allowedOrigins)
                // token in the query string is verified before the upgrade
                .addInterceptors(handshakeInterceptor);
    }
}
