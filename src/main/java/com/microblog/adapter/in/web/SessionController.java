package com.microblog.adapter.in.web;

import com.microblog.application.port.in.AuthenticateUseCase;
import com.microblog.domain.error.AuthError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.Session;
import com.microblog.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Sessions", description = "Sign in")
public class SessionController {

    private final AuthenticateUseCase authenticateUseCase;

    public SessionController(AuthenticateUseCase authenticateUseCase) {
        this.authenticateUseCase = authenticateUseCase;
    }

    @PostMapping("/sessions")
    @Operation(summary = "Sign in", description = "Exchanges username and password for a bearer session token")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest request) {
        Result<Session, AuthError> result = authenticateUseCase.login(request.username(), request.password());

        if (result.isFailure()) {
            AuthError error = result.errorOrNull();
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(result.getOrThrow()));
    }

    public record LoginRequest(
        @NotNull String username,
        @NotNull String password
    ) {}

    public record SessionResponse(
        String token,
        String tokenType,
        Instant expiresAt,
        UserResponse user
    ) {
        public static SessionResponse from(Session session) {
            return new SessionResponse(session.token(), "Bearer", session.expiresAt(), UserResponse.from(session.user()));
        }
    }
}
