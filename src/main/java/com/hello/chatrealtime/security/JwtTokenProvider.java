package com.hello.chatrealtime.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Signs and verifies the HS256 bearer tokens shared with the identity service.
 * Tokens carry the user id in an {@code id} claim (the subject is also set) and
 * the e-mail in {@code email}.
 */
@Component
public class JwtTokenProvider {

    private final SecretKey key;
    private final Duration expiration;
    private final Clock clock;

    public JwtTokenProvider(@Value("${chat.jwt.secret}") String secret,
            @Value("${chat.jwt.expiration:P7D}") Duration expiration,
            Clock clock) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiration = expiration;
        this.clock = clock;
    }

    public String generateToken(String userId, String email) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(userId)
                .claim("id", userId)
                .claim("email", email)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(expiration)))
                .signWith(key)
                .compact();
    }

    /**
     * Verifies signature and expiry and returns the user id.
     *
     * @throws JwtException if the token is malformed, badly signed, expired or has no user id
     */
    public String parseUserId(String token) {
        Claims claims = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token)
                .getPayload();
        String userId = claims.get("id", String.class);
        if (userId == null || userId.isBlank()) {
            userId = claims.getSubject();
        }
        if (userId == null || userId.isBlank()) {
            throw new JwtException("Token carries no user id");
        }
        return userId;
    }
}
