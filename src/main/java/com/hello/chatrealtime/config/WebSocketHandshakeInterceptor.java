package com.hello.chatrealtime.config;

import com.hello.chatrealtime.exception.AuthFailureException;
import com.hello.chatrealtime.exception.PersistenceFailureException;
import com.hello.chatrealtime.service.ConnectionLifecycleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Authenticates the bearer token passed as the {@code token} query parameter of the
 * upgrade request and stores the user id in the WebSocket session attributes.
 * A failed authentication refuses the upgrade with 401, so no connection, room
 * or presence state is ever created for it.
 */
@Component
public class WebSocketHandshakeInterceptor implements HandshakeInterceptor {

    public static final String USER_ID_ATTRIBUTE = "userId";
    public static final String TOKEN_PARAMETER = "token";

    private static final Logger logger = LoggerFactory.getLogger(WebSocketHandshakeInterceptor.class);

    private final ConnectionLifecycleService lifecycleService;

    public WebSocketHandshakeInterceptor(ConnectionLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @Override
    public boolean beforeHandshake(@NonNull ServerHttpRequest request,
            @NonNull ServerHttpResponse response,
            @NonNull WebSocketHandler wsHandler,
            @NonNull Map<String, Object> attributes) {
        String token = UriComponentsBuilder.fromUri(request.getURI())
                .build()
                .getQueryParams()
                .getFirst(TOKEN_PARAMETER);

        try {
            String userId = lifecycleService.authenticate(token);
            attributes.put(USER_ID_ATTRIBUTE, userId);
            return true;
        } catch (AuthFailureException e) {
            logger.info("[beforeHandshake] Rejected connection from {}: {}", request.getRemoteAddress(),
                    e.getReason().getCode());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        } catch (PersistenceFailureException e) {
            logger.error("[beforeHandshake] Could not verify user for connection from {}",
                    request.getRemoteAddress(), e);
            response.setStatusCode(HttpStatus.SERVICE_UNAVAILABLE);
            return false;
        }
    }

    @Override
    public void afterHandshake(@NonNull ServerHttpRequest request,
            @NonNull ServerHttpResponse response,
            @NonNull WebSocketHandler wsHandler,
            @Nullable Exception exception) {
        if (exception != null) {
            logger.warn("[afterHandshake] Handshake failed: {}", exception.getMessage());
        }
    }
}
