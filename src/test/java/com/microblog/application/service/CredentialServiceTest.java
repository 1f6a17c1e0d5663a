package com.microblog.application.service;

import com.microblog.adapter.out.security.JwtTokenCodec;
import com.microblog.adapter.out.security.Pbkdf2PasswordHasher;
import com.microblog.domain.model.Session;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against the real hasher and token codec; only the clock is pinned.
 */
@DisplayName("CredentialService")
class CredentialServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private AppProperties properties;
    private CredentialService credentials;
    private User user;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        properties.getSecurity().setSecretKey("test-secret");
        properties.getSecurity().setPbkdf2Iterations(1_000);
        credentials = serviceAt(NOW);
        user = new User(UserId.of(1), "john", "john@example.com", null, null, NOW);
    }

    private CredentialService serviceAt(Instant instant) {
        return new CredentialService(
            new Pbkdf2PasswordHasher(properties),
            new JwtTokenCodec(properties),
            properties,
            Clock.fixed(instant, ZoneOffset.UTC)
        );
    }

    @Nested
    @DisplayName("passwords")
    class PasswordTests {

        @Test
        @DisplayName("Should accept the password that was set and nothing else")
        void setThenCheck() {
            User withPassword = credentials.setPassword(user, "cat");

            assertNotNull(withPassword.passwordHash());
            assertNotEquals("cat", withPassword.passwordHash());
            assertTrue(credentials.checkPassword(withPassword, "cat"));
            assertFalse(credentials.checkPassword(withPassword, "dog"));
            assertFalse(credentials.checkPassword(withPassword, "Cat"));
        }

        @Test
        @DisplayName("Should overwrite an existing hash")
        void setOverwrites() {
            User first = credentials.setPassword(user, "cat");
            User second = credentials.setPassword(first, "dog");

            assertFalse(credentials.checkPassword(second, "cat"));
            assertTrue(credentials.checkPassword(second, "dog"));
        }

        @Test
        @DisplayName("Should return false instead of throwing for unusable input")
        void neverThrows() {
            User corrupt = user.withPasswordHash("zz-not-hex");

            assertFalse(credentials.checkPassword(user, "cat"));
            assertFalse(credentials.checkPassword(credentials.setPassword(user, "cat"), null));
            assertFalse(credentials.checkPassword(corrupt, "cat"));
        }
    }

    @Nested
    @DisplayName("reset tokens")
    class ResetTokenTests {

        @Test
        @DisplayName("Should verify to the user id within the ttl")
        void verifiesWithinTtl() {
            String token = credentials.issueResetToken(user, Duration.ofSeconds(600));

            assertEquals(Optional.of(UserId.of(1)), credentials.verifyResetToken(token));
            assertEquals(Optional.of(UserId.of(1)), serviceAt(NOW.plusSeconds(599)).verifyResetToken(token));
        }

        @Test
        @DisplayName("Should reject a token once the ttl has elapsed")
        void rejectsAfterTtl() {
            String token = credentials.issueResetToken(user, Duration.ofSeconds(600));

            assertTrue(serviceAt(NOW.plusSeconds(600)).verifyResetToken(token).isEmpty());
        }

        @Test
        @DisplayName("Should reject a token issued with zero ttl")
        void rejectsZeroTtl() {
            String token = credentials.issueResetToken(user, Duration.ZERO);

            assertTrue(credentials.verifyResetToken(token).isEmpty());
        }

        @Test
        @DisplayName("Should treat garbage as absent")
        void rejectsGarbage() {
            assertTrue(credentials.verifyResetToken("garbage").isEmpty());
            assertTrue(credentials.verifyResetToken(null).isEmpty());
        }
    }

    @Nested
    @DisplayName("session tokens")
    class SessionTokenTests {

        @Test
        @DisplayName("Should issue a session expiring after the configured ttl")
        void issuesSession() {
            properties.getSecurity().setSessionTokenTtl(Duration.ofHours(2));

            Session session = credentials.issueSession(user);

            assertEquals(NOW.plus(Duration.ofHours(2)), session.expiresAt());
            assertEquals(user, session.user());
            assertEquals(Optional.of(UserId.of(1)), credentials.verifySessionToken(session.token()));
        }

        @Test
        @DisplayName("Should not accept a session token as a reset token")
        void sessionIsNotReset() {
            Session session = credentials.issueSession(user);

            assertTrue(credentials.verifyResetToken(session.token()).isEmpty());
        }
    }
}
