package com.microblog.adapter.in.web;

import com.microblog.application.port.in.FollowUserUseCase;
import com.microblog.application.port.in.GetFollowersUseCase;
import com.microblog.application.port.in.GetFollowingUseCase;
import com.microblog.application.port.in.UnfollowUserUseCase;
import com.microblog.domain.error.FollowError;
import com.microblog.domain.error.ValidationError;
import com.microblog.domain.model.FollowCursor;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.config.AppProperties;
import com.microblog.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/users/{userId}")
@Tag(name = "Follows", description = "Social graph: follow, unfollow and the follower lists")
public class FollowController {

    private final FollowUserUseCase followUserUseCase;
    private final UnfollowUserUseCase unfollowUserUseCase;
    private final GetFollowingUseCase getFollowingUseCase;
    private final GetFollowersUseCase getFollowersUseCase;
    private final AppProperties appProperties;

    public FollowController(
            FollowUserUseCase followUserUseCase,
            UnfollowUserUseCase unfollowUserUseCase,
            GetFollowingUseCase getFollowingUseCase,
            GetFollowersUseCase getFollowersUseCase,
            AppProperties appProperties) {
        this.followUserUseCase = followUserUseCase;
        this.unfollowUserUseCase = unfollowUserUseCase;
        this.getFollowingUseCase = getFollowingUseCase;
        this.getFollowersUseCase = getFollowersUseCase;
        this.appProperties = appProperties;
    }

    @PostMapping("/follow/{targetId}")
    @Operation(summary = "Follow a user", description = "The signed-in user starts following the target. Repeating it is a no-op.")
    public ResponseEntity<?> follow(
            @Parameter(description = "Signed-in user", example = "1") @PathVariable String userId,
            @Parameter(description = "User to follow", example = "2") @PathVariable String targetId) {

        var denied = CurrentUser.requireMatch(userId);
        if (denied != null) return denied;

        var target = UserId.parse(targetId);
        if (target.isFailure()) {
            return badRequest(target.errorOrNull());
        }
        return respond(followUserUseCase.follow(RequestContext.getUserId(), target.getOrThrow()), userId, targetId, true);
    }

    @DeleteMapping("/follow/{targetId}")
    @Operation(summary = "Unfollow a user", description = "The signed-in user stops following the target. Repeating it is a no-op.")
    public ResponseEntity<?> unfollow(
            @Parameter(description = "Signed-in user", example = "1") @PathVariable String userId,
            @Parameter(description = "User to unfollow", example = "2") @PathVariable String targetId) {

        var denied = CurrentUser.requireMatch(userId);
        if (denied != null) return denied;

        var target = UserId.parse(targetId);
        if (target.isFailure()) {
            return badRequest(target.errorOrNull());
        }
        return respond(unfollowUserUseCase.unfollow(RequestContext.getUserId(), target.getOrThrow()), userId, targetId, false);
    }

    @GetMapping("/following/{targetId}")
    @Operation(summary = "Is following", description = "Whether the user follows the target")
    public ResponseEntity<?> isFollowing(@PathVariable String userId, @PathVariable String targetId) {
        var follower = UserId.parse(userId);
        if (follower.isFailure()) {
            return badRequest(follower.errorOrNull());
        }
        var followee = UserId.parse(targetId);
        if (followee.isFailure()) {
            return badRequest(followee.errorOrNull());
        }
        boolean following = followUserUseCase.isFollowing(follower.getOrThrow(), followee.getOrThrow());
        return ResponseEntity.ok(new FollowResponse(userId, targetId, following, false));
    }

    @GetMapping("/following")
    @Operation(summary = "Following list", description = "Users the user follows, most recently followed first")
    public ResponseEntity<?> following(
            @PathVariable String userId,
            @Parameter(description = "nextCursor from the previous page") @RequestParam(required = false) String cursor,
            @Parameter(description = "Page size, capped at app.feed.max-page-size") @RequestParam(required = false) Integer limit) {

        var owner = UserId.parse(userId);
        if (owner.isFailure()) {
            return badRequest(owner.errorOrNull());
        }
        var after = parseCursor(cursor);
        if (after.isFailure()) {
            return badRequest(after.errorOrNull());
        }
        return ResponseEntity.ok(PageResponse.ofUsers(
            getFollowingUseCase.getFollowing(owner.getOrThrow(), after.getOrThrow(), effectiveLimit(limit))));
    }

    @GetMapping("/followers")
    @Operation(summary = "Followers list", description = "Users following the user, most recent follower first")
    public ResponseEntity<?> followers(
            @PathVariable String userId,
            @Parameter(description = "nextCursor from the previous page") @RequestParam(required = false) String cursor,
            @Parameter(description = "Page size, capped at app.feed.max-page-size") @RequestParam(required = false) Integer limit) {

        var owner = UserId.parse(userId);
        if (owner.isFailure()) {
            return badRequest(owner.errorOrNull());
        }
        var after = parseCursor(cursor);
        if (after.isFailure()) {
            return badRequest(after.errorOrNull());
        }
        return ResponseEntity.ok(PageResponse.ofUsers(
            getFollowersUseCase.getFollowers(owner.getOrThrow(), after.getOrThrow(), effectiveLimit(limit))));
    }

    private static Result<FollowCursor, ValidationError> parseCursor(String cursor) {
        return cursor == null ? Result.success(null) : FollowCursor.parse(cursor);
    }

    private int effectiveLimit(Integer limit) {
        AppProperties.Feed feed = appProperties.getFeed();
        if (limit == null || limit < 1) {
            return feed.getDefaultPageSize();
        }
        return Math.min(limit, feed.getMaxPageSize());
    }

    private static ResponseEntity<?> respond(Result<Boolean, FollowError> result, String userId, String targetId, boolean following) {
        if (result.isSuccess()) {
            return ResponseEntity.ok(new FollowResponse(userId, targetId, following, result.getOrThrow()));
        }
        FollowError error = result.errorOrNull();
        HttpStatus status = error instanceof FollowError.UserNotFound ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status)
            .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
    }

    private static ResponseEntity<ErrorResponse> badRequest(ValidationError error) {
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
    }

    /**
     * {@code changed} is false when the request repeated the current state.
     */
    public record FollowResponse(
        String followerId,
        String followeeId,
        boolean following,
        boolean changed
    ) {}
}
