package com.microblog.application.service;

import com.microblog.application.port.in.CredentialUseCase;
import com.microblog.application.port.out.FollowQueryPort;
import com.microblog.application.port.out.FollowQueryPort.FollowCounts;
import com.microblog.application.port.out.IdGenerator;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.UserRepository;
import com.microblog.domain.error.IdentityError;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("IdentityService")
class IdentityServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private UserRepository userRepository;

    @Mock
    private FollowQueryPort followQueryPort;

    @Mock
    private CredentialUseCase credentials;

    @Mock
    private IdGenerator idGenerator;

    @Mock
    private MetricsPort metrics;

    private IdentityService identityService;

    @BeforeEach
    void setUp() {
        identityService = new IdentityService(
                userRepository, followQueryPort, credentials, idGenerator, metrics, Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    private static User user(long id, String username) {
        return new User(UserId.of(id), username, username + "@example.com", "hash", null, NOW);
    }

    @Nested
    @DisplayName("register")
    class RegisterTests {

        @Test
        @DisplayName("Should hash the password and insert the user")
        void shouldRegister() {
            // Given
            when(idGenerator.nextUserId()).thenReturn(1L);
            when(userRepository.existsByUsername("john")).thenReturn(false);
            when(userRepository.existsByEmail("john@example.com")).thenReturn(false);
            when(credentials.setPassword(any(User.class), eq("cat")))
                .thenAnswer(inv -> inv.<User>getArgument(0).withPasswordHash("hashed"));
            when(userRepository.insert(any(User.class))).thenReturn(true);

            // When
            var result = identityService.register("john", "john@example.com", "cat");

            // Then
            assertTrue(result.isSuccess());
            User user = result.getOrThrow();
            assertEquals(UserId.of(1), user.id());
            assertEquals("hashed", user.passwordHash());
            assertEquals(NOW, user.lastSeen());
            verify(userRepository).insert(user);
            verify(metrics).incrementRegistrations();
        }

        @Test
        @DisplayName("Should fail with DuplicateUsername and persist nothing")
        void shouldRejectDuplicateUsername() {
            // Given
            when(idGenerator.nextUserId()).thenReturn(2L);
            when(userRepository.existsByUsername("john")).thenReturn(true);

            // When
            var result = identityService.register("john", "other@example.com", "cat");

            // Then
            assertTrue(result.isFailure());
            var error = assertInstanceOf(IdentityError.DuplicateUsername.class, result.errorOrNull());
            assertEquals("DUPLICATE_USERNAME", error.code());
            verify(userRepository, never()).insert(any());
            verifyNoInteractions(credentials, metrics);
        }

        @Test
        @DisplayName("Should fail with DuplicateEmail when only the email is taken")
        void shouldRejectDuplicateEmail() {
            // Given
            when(idGenerator.nextUserId()).thenReturn(2L);
            when(userRepository.existsByUsername("susan")).thenReturn(false);
            when(userRepository.existsByEmail("john@example.com")).thenReturn(true);

            // When
            var result = identityService.register("susan", "john@example.com", "cat");

            // Then
            assertInstanceOf(IdentityError.DuplicateEmail.class, result.errorOrNull());
            verify(userRepository, never()).insert(any());
        }

        @Test
        @DisplayName("Should report the constraint that won a concurrent registration")
        void shouldReportLostInsertRace() {
            // Given
            when(idGenerator.nextUserId()).thenReturn(3L);
            when(userRepository.existsByUsername("john")).thenReturn(false, true);
            when(userRepository.existsByEmail("john@example.com")).thenReturn(false);
            when(credentials.setPassword(any(User.class), eq("cat")))
                .thenAnswer(inv -> inv.<User>getArgument(0).withPasswordHash("hashed"));
            when(userRepository.insert(any(User.class))).thenReturn(false);

            // When
            var result = identityService.register("john", "john@example.com", "cat");

            // Then
            assertInstanceOf(IdentityError.DuplicateUsername.class, result.errorOrNull());
            verify(metrics, never()).incrementRegistrations();
        }

        @Test
        @DisplayName("Should reject a blank password before touching storage")
        void shouldRejectBlankPassword() {
            var result = identityService.register("john", "john@example.com", "  ");

            assertInstanceOf(IdentityError.InvalidField.class, result.errorOrNull());
            verifyNoInteractions(userRepository, idGenerator, credentials);
        }

        @Test
        @DisplayName("Should reject a malformed email")
        void shouldRejectMalformedEmail() {
            when(idGenerator.nextUserId()).thenReturn(4L);

            var result = identityService.register("john", "no-at-sign", "cat");

            var error = assertInstanceOf(IdentityError.InvalidField.class, result.errorOrNull());
            assertEquals("EMAIL_INVALID", error.code());
            verifyNoInteractions(userRepository);
        }
    }

    @Nested
    @DisplayName("updateProfile")
    class UpdateProfileTests {

        @Test
        @DisplayName("Should apply a new username and about-me")
        void shouldUpdateProfile() {
            // Given
            User john = user(1, "john");
            when(userRepository.findById(john.id())).thenReturn(Optional.of(john));
            when(userRepository.existsByUsername("johnny")).thenReturn(false);

            // When
            var result = identityService.updateProfile(john.id(), "johnny", "I like cats");

            // Then
            assertTrue(result.isSuccess());
            assertEquals("johnny", result.getOrThrow().username());
            assertEquals("I like cats", result.getOrThrow().aboutMe());
            verify(userRepository).updateProfile(john.id(), "johnny", "I like cats");
            verify(userRepository, never()).updatePassword(any(), any());
        }

        @Test
        @DisplayName("Should fail with UsernameUnavailable when another user has the name")
        void shouldRejectTakenUsername() {
            // Given
            User john = user(1, "john");
            when(userRepository.findById(john.id())).thenReturn(Optional.of(john));
            when(userRepository.existsByUsername("susan")).thenReturn(true);

            // When
            var result = identityService.updateProfile(john.id(), "susan", null);

            // Then
            assertInstanceOf(IdentityError.UsernameUnavailable.class, result.errorOrNull());
            verify(userRepository, never()).updateProfile(any(), any(), any());
        }

        @Test
        @DisplayName("Should keep the current username without a uniqueness check")
        void shouldAllowKeepingOwnUsername() {
            // Given
            User john = user(1, "john");
            when(userRepository.findById(john.id())).thenReturn(Optional.of(john));

            // When
            var result = identityService.updateProfile(john.id(), "john", "new bio");

            // Then
            assertTrue(result.isSuccess());
            verify(userRepository, never()).existsByUsername(any());
        }

        @Test
        @DisplayName("Should reject about-me over 140 characters")
        void shouldRejectLongAboutMe() {
            User john = user(1, "john");
            when(userRepository.findById(john.id())).thenReturn(Optional.of(john));

            var result = identityService.updateProfile(john.id(), null, "a".repeat(141));

            assertInstanceOf(IdentityError.InvalidField.class, result.errorOrNull());
            verify(userRepository, never()).updateProfile(any(), any(), any());
        }

        @Test
        @DisplayName("Should fail with IdentityNotFound for a missing user")
        void shouldFailForMissingUser() {
            when(userRepository.findById(UserId.of(99))).thenReturn(Optional.empty());

            var result = identityService.updateProfile(UserId.of(99), "x", null);

            assertInstanceOf(IdentityError.IdentityNotFound.class, result.errorOrNull());
        }
    }

    @Nested
    @DisplayName("getProfile")
    class GetProfileTests {

        @Test
        @DisplayName("Should include follower and following counts")
        void shouldIncludeCounts() {
            User john = user(1, "john");
            when(userRepository.findById(john.id())).thenReturn(Optional.of(john));
            when(followQueryPort.countsFor(john.id())).thenReturn(new FollowCounts(3, 5));

            var profile = identityService.getProfile(john.id()).getOrThrow();

            assertEquals(john, profile.user());
            assertEquals(3, profile.followerCount());
            assertEquals(5, profile.followingCount());
        }

        @Test
        @DisplayName("Should fail with IdentityNotFound for a missing user")
        void shouldFailForMissingUser() {
            when(userRepository.findById(UserId.of(7))).thenReturn(Optional.empty());

            var result = identityService.getProfile(UserId.of(7));

            assertInstanceOf(IdentityError.IdentityNotFound.class, result.errorOrNull());
            verifyNoInteractions(followQueryPort);
        }
    }

    @Test
    @DisplayName("touchLastSeen should stamp the clock's current time")
    void touchLastSeenUsesClock() {
        identityService.touchLastSeen(UserId.of(1));

        verify(userRepository).touchLastSeen(UserId.of(1), NOW);
    }
}
