package com.microblog.adapter.in.web;

import com.microblog.application.port.in.RequestPasswordResetUseCase;
import com.microblog.application.port.in.ResetPasswordUseCase;
import com.microblog.domain.error.AuthError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Password resets", description = "Reset a forgotten password by mail")
public class PasswordResetController {

    private final RequestPasswordResetUseCase requestPasswordResetUseCase;
    private final ResetPasswordUseCase resetPasswordUseCase;

    public PasswordResetController(
            RequestPasswordResetUseCase requestPasswordResetUseCase,
            ResetPasswordUseCase resetPasswordUseCase) {
        this.requestPasswordResetUseCase = requestPasswordResetUseCase;
        this.resetPasswordUseCase = resetPasswordUseCase;
    }

    @PostMapping("/password-resets")
    @Operation(summary = "Request a reset", description = "Mails a reset link if the address is registered. Always 202.")
    public ResponseEntity<Void> requestReset(@Valid @RequestBody ResetRequest request) {
        requestPasswordResetUseCase.requestPasswordReset(request.email());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/password-resets/{token}")
    @Operation(summary = "Apply a reset", description = "Sets a new password using the token from the reset mail")
    public ResponseEntity<?> resetPassword(
            @Parameter(description = "Token from the reset link")
            @PathVariable String token,
            @Valid @RequestBody NewPasswordRequest request) {

        Result<User, AuthError> result = resetPasswordUseCase.resetPassword(token, request.password());

        if (result.isFailure()) {
            AuthError error = result.errorOrNull();
            return ResponseEntity.badRequest()
                .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
        }
        return ResponseEntity.ok(UserResponse.from(result.getOrThrow()));
    }

    public record ResetRequest(@NotNull String email) {}

    public record NewPasswordRequest(@NotNull String password) {}
}
