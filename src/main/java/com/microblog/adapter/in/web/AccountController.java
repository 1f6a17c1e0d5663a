package com.microblog.adapter.in.web;

import com.microblog.application.port.in.RegisterUserUseCase;
import com.microblog.domain.error.IdentityError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
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

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Accounts", description = "Registration")
public class AccountController {

    private final RegisterUserUseCase registerUserUseCase;

    public AccountController(RegisterUserUseCase registerUserUseCase) {
        this.registerUserUseCase = registerUserUseCase;
    }

    @PostMapping("/accounts")
    @Operation(summary = "Register", description = "Creates a user with a unique username and email")
    public ResponseEntity<?> register(@Valid @RequestBody RegisterRequest request) {
        Result<User, IdentityError> result = registerUserUseCase.register(
            request.username(),
            request.email(),
            request.password()
        );

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(result.getOrThrow()))
            : toErrorResponse(result.errorOrNull());
    }

    private ResponseEntity<ErrorResponse> toErrorResponse(IdentityError error) {
        HttpStatus status = error instanceof IdentityError.InvalidField
            ? HttpStatus.BAD_REQUEST
            : HttpStatus.CONFLICT;
        return ResponseEntity.status(status)
            .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
    }

    public record RegisterRequest(
        @NotNull String username,
        @NotNull String email,
        @NotNull String password
    ) {}
}
