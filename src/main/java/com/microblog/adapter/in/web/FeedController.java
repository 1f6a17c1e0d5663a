package com.microblog.adapter.in.web;

import com.microblog.application.port.in.GetExploreUseCase;
import com.microblog.application.port.in.GetFeedUseCase;
import com.microblog.domain.model.NumberedPage;
import com.microblog.domain.model.Post;
import com.microblog.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Feed", description = "Home feed and explore")
public class FeedController {

    private final GetFeedUseCase getFeedUseCase;
    private final GetExploreUseCase getExploreUseCase;

    public FeedController(GetFeedUseCase getFeedUseCase, GetExploreUseCase getExploreUseCase) {
        this.getFeedUseCase = getFeedUseCase;
        this.getExploreUseCase = getExploreUseCase;
    }

    @GetMapping("/users/{userId}/feed")
    @Operation(summary = "Get home feed", description = "Posts by the user and by everyone the user follows, newest first")
    public ResponseEntity<?> getFeed(
            @Parameter(description = "User ID (must be the signed-in user)", example = "1")
            @PathVariable String userId,
            @Parameter(description = "1-indexed page number")
            @RequestParam(defaultValue = "1") int page) {

        var authError = CurrentUser.requireMatch(userId);
        if (authError != null) return authError;

        NumberedPage<Post> feed = getFeedUseCase.getFeed(RequestContext.getUserId(), page);
        return ResponseEntity.ok(NumberedPageResponse.from(feed, PostResponse::from));
    }

    @GetMapping("/explore")
    @Operation(summary = "Explore", description = "Every post, newest first")
    public ResponseEntity<?> getExplore(
            @Parameter(description = "1-indexed page number")
            @RequestParam(defaultValue = "1") int page) {

        NumberedPage<Post> posts = getExploreUseCase.getExplore(page);
        return ResponseEntity.ok(NumberedPageResponse.from(posts, PostResponse::from));
    }
}
