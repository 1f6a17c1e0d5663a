package com.microblog.adapter.in.web;

import com.microblog.application.port.in.CreatePostUseCase;
import com.microblog.application.port.in.GetUserPostsUseCase;
import com.microblog.domain.error.PostError;
import com.microblog.domain.error.ValidationError;
import com.microblog.domain.model.NumberedPage;
import com.microblog.domain.model.Post;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Posts", description = "Post operations")
public class PostController {

    private final CreatePostUseCase createPostUseCase;
    private final GetUserPostsUseCase getUserPostsUseCase;

    public PostController(
            CreatePostUseCase createPostUseCase,
            GetUserPostsUseCase getUserPostsUseCase) {
        this.createPostUseCase = createPostUseCase;
        this.getUserPostsUseCase = getUserPostsUseCase;
    }

    @PostMapping("/posts")
    @Operation(summary = "Create a new post", description = "Creates a post for the authenticated user (max 140 characters)")
    public ResponseEntity<?> createPost(@Valid @RequestBody CreatePostRequest request) {
        Result<Post, PostError> result = createPostUseCase.createPost(RequestContext.getUserId(), request.body());

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(PostResponse.from(result.getOrThrow()))
            : toErrorResponse(result.errorOrNull());
    }

    @GetMapping("/users/{userId}/posts")
    @Operation(summary = "Get user's posts", description = "Returns one page of the user's posts, newest first")
    public ResponseEntity<?> getUserPosts(
            @Parameter(description = "User ID", example = "1")
            @PathVariable String userId,
            @Parameter(description = "1-indexed page number")
            @RequestParam(defaultValue = "1") int page) {

        var userIdResult = UserId.parse(userId);
        if (userIdResult.isFailure()) {
            return toValidationErrorResponse(userIdResult.errorOrNull());
        }

        NumberedPage<Post> posts = getUserPostsUseCase.getUserPosts(userIdResult.getOrThrow(), page);
        return ResponseEntity.ok(NumberedPageResponse.from(posts, PostResponse::from));
    }

    private ResponseEntity<ErrorResponse> toErrorResponse(PostError error) {
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
    }

    private ResponseEntity<ErrorResponse> toValidationErrorResponse(ValidationError error) {
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
    }

    public record CreatePostRequest(String body) {}
}
