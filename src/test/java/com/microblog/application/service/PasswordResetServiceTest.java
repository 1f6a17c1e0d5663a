package com.microblog.application.service;

import com.microblog.application.port.in.CredentialUseCase;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.NotificationSender;
import com.microblog.application.port.out.UserRepository;
import com.microblog.domain.error.AuthError;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PasswordResetService")
class PasswordResetServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private CredentialUseCase credentials;

    @Mock
    private NotificationSender notificationSender;

    @Mock
    private MetricsPort metrics;

    private PasswordResetService passwordResetService;

    private final User john = new User(UserId.of(1), "john", "john@example.com", "old-hash", null, Instant.EPOCH);

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.getSecurity().setResetTokenTtl(Duration.ofSeconds(600));
        properties.getMail().setResetUrlTemplate("https://microblog.test/reset/{token}");
        passwordResetService = new PasswordResetService(
                userRepository, credentials, notificationSender, properties, metrics
        );
    }

    @Nested
    @DisplayName("requestPasswordReset")
    class RequestTests {

        @Test
        @DisplayName("Should mail a reset link to a registered address")
        void shouldSendResetMail() {
            // Given
            when(userRepository.findByEmail("john@example.com")).thenReturn(Optional.of(john));
            when(credentials.issueResetToken(john, Duration.ofSeconds(600))).thenReturn("tok123");

            // When
            passwordResetService.requestPasswordReset(" john@example.com ");

            // Then
            ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
            ArgumentCaptor<String> html = ArgumentCaptor.forClass(String.class);
            verify(notificationSender).send(
                eq(PasswordResetService.RESET_SUBJECT), eq(List.of("john@example.com")), text.capture(), html.capture());
            assertTrue(text.getValue().contains("https://microblog.test/reset/tok123"));
            assertTrue(text.getValue().contains("Dear john"));
            assertTrue(html.getValue().contains("href=\"https://microblog.test/reset/tok123\""));
        }

        @Test
        @DisplayName("Should complete silently for an unknown address")
        void shouldIgnoreUnknownEmail() {
            when(userRepository.findByEmail("nobody@example.com")).thenReturn(Optional.empty());

            assertDoesNotThrow(() -> passwordResetService.requestPasswordReset("nobody@example.com"));
            verifyNoInteractions(notificationSender, credentials);
        }

        @Test
        @DisplayName("Should ignore a blank address")
        void shouldIgnoreBlank() {
            passwordResetService.requestPasswordReset(" ");

            verifyNoInteractions(userRepository, notificationSender);
        }
    }

    @Nested
    @DisplayName("resetPassword")
    class ResetTests {

        @Test
        @DisplayName("Should set and persist the new password")
        void shouldResetPassword() {
            // Given
            User updated = john.withPasswordHash("new-hash");
            when(credentials.verifyResetToken("tok")).thenReturn(Optional.of(john.id()));
            when(userRepository.findById(john.id())).thenReturn(Optional.of(john));
            when(credentials.setPassword(john, "dog")).thenReturn(updated);

            // When
            var result = passwordResetService.resetPassword("tok", "dog");

            // Then
            assertEquals(updated, result.getOrThrow());
            verify(userRepository).updatePassword(john.id(), "new-hash");
            verify(userRepository, never()).updateProfile(any(), any(), any());
            verify(metrics).incrementPasswordResets();
        }

        @Test
        @DisplayName("Should fail verification for an invalid or expired token")
        void shouldRejectBadToken() {
            when(credentials.verifyResetToken("expired")).thenReturn(Optional.empty());

            var result = passwordResetService.resetPassword("expired", "dog");

            assertSame(AuthError.VerificationFailed.INSTANCE, result.errorOrNull());
            verifyNoInteractions(userRepository);
        }

        @Test
        @DisplayName("Should fail verification when the token names a deleted user")
        void shouldRejectTokenForDeletedUser() {
            when(credentials.verifyResetToken("tok")).thenReturn(Optional.of(UserId.of(99)));
            when(userRepository.findById(UserId.of(99))).thenReturn(Optional.empty());

            var result = passwordResetService.resetPassword("tok", "dog");

            assertSame(AuthError.VerificationFailed.INSTANCE, result.errorOrNull());
            verify(userRepository, never()).updatePassword(any(), any());
        }

        @Test
        @DisplayName("Should reject a blank new password")
        void shouldRejectBlankPassword() {
            when(credentials.verifyResetToken("tok")).thenReturn(Optional.of(john.id()));
            when(userRepository.findById(john.id())).thenReturn(Optional.of(john));

            var result = passwordResetService.resetPassword("tok", "");

            assertInstanceOf(AuthError.InvalidPassword.class, result.errorOrNull());
            verify(credentials, never()).setPassword(any(), anyString());
        }
    }
}
