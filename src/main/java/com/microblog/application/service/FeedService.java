package com.microblog.application.service;

import com.microblog.application.port.in.GetExploreUseCase;
import com.microblog.application.port.in.GetFeedUseCase;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.PostRepository;
import com.microblog.domain.model.NumberedPage;
import com.microblog.domain.model.Post;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class FeedService implements GetFeedUseCase, GetExploreUseCase {

    private static final Logger log = LoggerFactory.getLogger(FeedService.class);

    private final PostRepository postRepository;
    private final AppProperties appProperties;
    private final MetricsPort metrics;

    public FeedService(
            PostRepository postRepository,
            AppProperties appProperties,
            MetricsPort metrics) {
        this.postRepository = postRepository;
        this.appProperties = appProperties;
        this.metrics = metrics;
    }

    @Override
    @Transactional(readOnly = true)
    public NumberedPage<Post> getFeed(UserId userId, int page) {
        int pageSize = appProperties.getFeed().getPostsPerPage();
        NumberedPage<Post> result = PostPager.page(
            (offset, limit) -> postRepository.findFeed(userId, offset, limit), page, pageSize);

        metrics.incrementFeedRequests();
        log.info("Feed served: user={}, page={}, posts={}, hasNext={}, hasPrev={}",
            userId, page, result.items().size(), result.hasNext(), result.hasPrev());
        return result;
    }

    @Override
    @Transactional(readOnly = true)
    public NumberedPage<Post> getExplore(int page) {
        int pageSize = appProperties.getFeed().getPostsPerPage();
        NumberedPage<Post> result = PostPager.page(postRepository::findAll, page, pageSize);

        log.debug("Explore served: page={}, posts={}, hasNext={}", page, result.items().size(), result.hasNext());
        return result;
    }
}
