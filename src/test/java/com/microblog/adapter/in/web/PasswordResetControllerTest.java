package com.microblog.adapter.in.web;

import com.microblog.application.port.in.AuthenticateUseCase;
import com.microblog.application.port.in.RequestPasswordResetUseCase;
import com.microblog.application.port.in.ResetPasswordUseCase;
import com.microblog.domain.error.AuthError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(PasswordResetController.class)
class PasswordResetControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RequestPasswordResetUseCase requestPasswordResetUseCase;

    @MockBean
    private ResetPasswordUseCase resetPasswordUseCase;

    // Required for Spring context - used by AuthFilter
    @MockBean
    private AuthenticateUseCase authenticateUseCase;

    @Test
    void requestIsAlwaysAccepted() throws Exception {
        mockMvc.perform(post("/api/v1/password-resets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\":\"nobody@example.com\"}"))
            .andExpect(status().isAccepted());

        verify(requestPasswordResetUseCase).requestPasswordReset("nobody@example.com");
    }

    @Test
    void shouldApplyResetWithValidToken() throws Exception {
        User john = new User(UserId.of(1), "john", "john@example.com", "new-hash", null, Instant.now());
        when(resetPasswordUseCase.resetPassword("tok", "dog")).thenReturn(Result.success(john));

        mockMvc.perform(post("/api/v1/password-resets/tok")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"password\":\"dog\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.username").value("john"));
    }

    @Test
    void shouldRejectInvalidToken() throws Exception {
        when(resetPasswordUseCase.resetPassword("expired", "dog"))
            .thenReturn(Result.failure(AuthError.VerificationFailed.INSTANCE));

        mockMvc.perform(post("/api/v1/password-resets/expired")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"password\":\"dog\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VERIFICATION_FAILED"));
    }
}
