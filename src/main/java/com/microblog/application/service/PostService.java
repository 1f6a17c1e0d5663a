package com.microblog.application.service;

import com.microblog.application.port.in.CreatePostUseCase;
import com.microblog.application.port.in.GetUserPostsUseCase;
import com.microblog.application.port.out.IdGenerator;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.PostRepository;
import com.microblog.domain.error.PostError;
import com.microblog.domain.model.NumberedPage;
import com.microblog.domain.model.Post;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

@Service
public class PostService implements CreatePostUseCase, GetUserPostsUseCase {

    private static final Logger log = LoggerFactory.getLogger(PostService.class);

    private final PostRepository postRepository;
    private final IdGenerator idGenerator;
    private final AppProperties appProperties;
    private final MetricsPort metrics;
    private final Clock clock;

    public PostService(
            PostRepository postRepository,
            IdGenerator idGenerator,
            AppProperties appProperties,
            MetricsPort metrics,
            Clock clock) {
        this.postRepository = postRepository;
        this.idGenerator = idGenerator;
        this.appProperties = appProperties;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Result<Post, PostError> createPost(UserId authorId, String body) {
        log.debug("Creating post for user={}, bodyLength={}", authorId, body != null ? body.length() : 0);

        var postResult = Post.create(idGenerator.nextPostId(), authorId, body, clock.instant());
        if (postResult.isFailure()) {
            log.warn("Post validation failed for user={}: {}", authorId, postResult.errorOrNull().message());
            return Result.failure(new PostError.ValidationFailed(postResult.errorOrNull()));
        }

        Post post = postResult.getOrThrow();
        postRepository.save(post);

        metrics.incrementPostsCreated();
        log.info("Post created: postId={}, userId={}, chars={}", post.id(), authorId, post.body().length());

        return Result.success(post);
    }

    @Override
    @Transactional(readOnly = true)
    public NumberedPage<Post> getUserPosts(UserId authorId, int page) {
        int pageSize = appProperties.getFeed().getPostsPerPage();
        log.debug("Fetching posts for user={}, page={}", authorId, page);
        return PostPager.page((offset, limit) -> postRepository.findByAuthor(authorId, offset, limit), page, pageSize);
    }
}
