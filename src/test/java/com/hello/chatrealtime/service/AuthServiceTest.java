package com.hello.chatrealtime.service;

import com.hello.chatrealtime.exception.AuthFailureException;
import com.hello.chatrealtime.exception.AuthFailureException.Reason;
import com.hello.chatrealtime.persistence.ChatPersistenceGateway;
import com.hello.chatrealtime.security.JwtTokenProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @Mock
    private ChatPersistenceGateway persistenceGateway;

    private JwtTokenProvider tokenProvider;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        tokenProvider = new JwtTokenProvider("test-secret-test-secret-test-secret-42", Duration.ofMinutes(5),
                Clock.fixed(NOW, ZoneOffset.UTC));
        authService = new AuthService(tokenProvider, persistenceGateway);
    }

    @Test
    void validTokenForKnownUser() {
        when(persistenceGateway.userExists("user-1")).thenReturn(true);

        assertThat(authService.authenticate(tokenProvider.generateToken("user-1", "a@b.c"))).isEqualTo("user-1");
    }

    @Test
    void missingToken() {
        assertThatThrownBy(() -> authService.authenticate(null))
                .isInstanceOfSatisfying(AuthFailureException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.MISSING_TOKEN));
        assertThatThrownBy(() -> authService.authenticate("  "))
                .isInstanceOfSatisfying(AuthFailureException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.MISSING_TOKEN));
    }

    @Test
    void invalidToken() {
        assertThatThrownBy(() -> authService.authenticate("abc.def.ghi"))
                .isInstanceOfSatisfying(AuthFailureException.class,
                        e -> assertThat(e.getReason().getCode()).isEqualTo("invalid_token"));
    }

    @Test
    void expiredTokenIsInvalid() {
        JwtTokenProvider earlier = new JwtTokenProvider("test-secret-test-secret-test-secret-42",
                Duration.ofMinutes(5), Clock.fixed(NOW.minus(Duration.ofHours(1)), ZoneOffset.UTC));

        assertThatThrownBy(() -> authService.authenticate(earlier.generateToken("user-1", "a@b.c")))
                .isInstanceOfSatisfying(AuthFailureException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.INVALID_TOKEN));
    }

    @Test
    void unknownUser() {
        when(persistenceGateway.userExists("ghost")).thenReturn(false);

        assertThatThrownBy(() -> authService.authenticate(tokenProvider.generateToken("ghost", "g@b.c")))
                .isInstanceOfSatisfying(AuthFailureException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.USER_NOT_FOUND));
    }
}
