package com.hello.chatrealtime.security;

import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtTokenProviderTest {

    private static final String SECRET = "test-secret-test-secret-test-secret-42";
    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET, Duration.ofHours(1), clock);

    @Test
    void generatedTokenResolvesToUserId() {
        String token = provider.generateToken("user-1", "one@example.com");

        assertThat(provider.parseUserId(token)).isEqualTo("user-1");
    }

    @Test
    void subjectIsUsedWhenIdClaimIsAbsent() {
        String token = Jwts.builder()
                .subject("user-2")
                .expiration(Date.from(NOW.plusSeconds(60)))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();

        assertThat(provider.parseUserId(token)).isEqualTo("user-2");
    }

    @Test
    void tokenWithoutAnyUserIdIsRejected() {
        String token = Jwts.builder()
                .claim("email", "nobody@example.com")
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();

        assertThatThrownBy(() -> provider.parseUserId(token)).isInstanceOf(JwtException.class);
    }

    @Test
    void expiredTokenIsRejected() {
        String token = provider.generateToken("user-1", "one@example.com");
        JwtTokenProvider later = new JwtTokenProvider(SECRET, Duration.ofHours(1),
                Clock.fixed(NOW.plus(Duration.ofHours(2)), ZoneOffset.UTC));

        assertThatThrownBy(() -> later.parseUserId(token)).isInstanceOf(ExpiredJwtException.class);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenProvider other = new JwtTokenProvider("another-secret-another-secret-another-1",
                Duration.ofHours(1), clock);
        String token = other.generateToken("user-1", "one@example.com");

        assertThatThrownBy(() -> provider.parseUserId(token)).isInstanceOf(JwtException.class);
    }

    @Test
    void garbageIsRejected() {
        assertThatThrownBy(() -> provider.parseUserId("not-a-token")).isInstanceOf(JwtException.class);
    }
}
