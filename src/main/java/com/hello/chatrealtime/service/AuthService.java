package com.hello.chatrealtime.service;

import com.hello.chatrealtime.exception.AuthFailureException;
import com.hello.chatrealtime.exception.AuthFailureException.Reason;
import com.hello.chatrealtime.persistence.ChatPersistenceGateway;
import com.hello.chatrealtime.security.JwtTokenProvider;
import io.jsonwebtoken.JwtException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Resolves a bearer token to a known user id. Used by the WebSocket handshake and
 * by the HTTP filter alike.
 */
@Service
public class AuthService {

    private final JwtTokenProvider tokenProvider;
    private final ChatPersistenceGateway persistenceGateway;

    @Autowired
    public AuthService(JwtTokenProvider tokenProvider, ChatPersistenceGateway persistenceGateway) {
        this.tokenProvider = tokenProvider;
        this.persistenceGateway = persistenceGateway;
    }

    public String authenticate(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthFailureException(Reason.MISSING_TOKEN, "Authentication required");
        }

        String userId;
        try {
            userId = tokenProvider.parseUserId(token);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthFailureException(Reason.INVALID_TOKEN, "Invalid token", e);
        }

        if (!persistenceGateway.userExists(userId)) {
            throw new AuthFailureException(Reason.USER_NOT_FOUND, "User not found");
        }
        return userId;
    }
}
