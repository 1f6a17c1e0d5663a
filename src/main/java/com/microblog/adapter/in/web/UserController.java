package com.microblog.adapter.in.web;

import com.microblog.application.port.in.GetUserUseCase;
import com.microblog.application.port.in.UpdateProfileUseCase;
import com.microblog.domain.error.IdentityError;
import com.microblog.domain.error.ValidationError;
import com.microblog.domain.model.Profile;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.context.RequestContext;
import com.microblog.infrastructure.exception.UserNotFoundException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Users", description = "Profiles")
public class UserController {

    private final GetUserUseCase getUserUseCase;
    private final UpdateProfileUseCase updateProfileUseCase;

    public UserController(GetUserUseCase getUserUseCase, UpdateProfileUseCase updateProfileUseCase) {
        this.getUserUseCase = getUserUseCase;
        this.updateProfileUseCase = updateProfileUseCase;
    }

    @GetMapping("/users/{userId}")
    @Operation(summary = "Get a profile", description = "User details with follower and following counts")
    public ResponseEntity<?> getProfile(
            @Parameter(description = "User ID", example = "42")
            @PathVariable String userId) {

        var userIdResult = UserId.parse(userId);
        if (userIdResult.isFailure()) {
            return toValidationErrorResponse(userIdResult.errorOrNull());
        }

        Result<Profile, IdentityError> result = getUserUseCase.getProfile(userIdResult.getOrThrow());
        return result.isSuccess()
            ? ResponseEntity.ok(ProfileResponse.from(result.getOrThrow()))
            : toErrorResponse(result.errorOrNull());
    }

    @GetMapping("/users/by-username/{username}")
    @Operation(summary = "Look up a user by username")
    public ResponseEntity<UserResponse> getByUsername(@PathVariable String username) {
        User user = getUserUseCase.findByUsername(username)
            .orElseThrow(() -> new UserNotFoundException(username));
        return ResponseEntity.ok(UserResponse.from(user));
    }

    @PutMapping("/users/{userId}/profile")
    @Operation(summary = "Edit profile", description = "Changes username and/or about-me of the signed-in user")
    public ResponseEntity<?> updateProfile(
            @Parameter(description = "User ID", example = "42")
            @PathVariable String userId,
            @RequestBody UpdateProfileRequest request) {

        var authError = CurrentUser.requireMatch(userId);
        if (authError != null) return authError;

        Result<User, IdentityError> result = updateProfileUseCase.updateProfile(
            RequestContext.getUserId(),
            request.username(),
            request.aboutMe()
        );

        return result.isSuccess()
            ? ResponseEntity.ok(UserResponse.from(result.getOrThrow()))
            : toErrorResponse(result.errorOrNull());
    }

    private ResponseEntity<ErrorResponse> toErrorResponse(IdentityError error) {
        HttpStatus status;
        if (error instanceof IdentityError.IdentityNotFound) {
            status = HttpStatus.NOT_FOUND;
        } else if (error instanceof IdentityError.InvalidField) {
            status = HttpStatus.BAD_REQUEST;
        } else {
            status = HttpStatus.CONFLICT;
        }
        return ResponseEntity.status(status)
            .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
    }

    private ResponseEntity<ErrorResponse> toValidationErrorResponse(ValidationError error) {
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
    }

    public record UpdateProfileRequest(String username, String aboutMe) {}

    public record ProfileResponse(
        UserResponse user,
        long followerCount,
        long followingCount
    ) {
        public static ProfileResponse from(Profile profile) {
            return new ProfileResponse(
                UserResponse.from(profile.user()),
                profile.followerCount(),
                profile.followingCount()
            );
        }
    }
}
