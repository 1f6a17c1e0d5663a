package com.microblog.application.service;

import com.microblog.application.port.in.FollowUserUseCase;
import com.microblog.application.port.in.GetFollowersUseCase;
import com.microblog.application.port.in.GetFollowingUseCase;
import com.microblog.application.port.in.UnfollowUserUseCase;
import com.microblog.application.port.out.FollowRepository;
import com.microblog.application.port.out.FollowRepository.Edge;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.UserRepository;
import com.microblog.domain.error.FollowError;
import com.microblog.domain.error.ValidationError.FollowValidationError;
import com.microblog.domain.model.Follow;
import com.microblog.domain.model.FollowCursor;
import com.microblog.domain.model.Page;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * The social graph. Following and unfollowing are idempotent: repeating either one
 * succeeds and leaves the edge table as it was.
 */
@Service
public class FollowService implements FollowUserUseCase, UnfollowUserUseCase, GetFollowingUseCase, GetFollowersUseCase {

    private static final Logger log = LoggerFactory.getLogger(FollowService.class);

    private final FollowRepository followRepository;
    private final UserRepository userRepository;
    private final MetricsPort metrics;
    private final Clock clock;

    public FollowService(
            FollowRepository followRepository,
            UserRepository userRepository,
            MetricsPort metrics,
            Clock clock) {
        this.followRepository = followRepository;
        this.userRepository = userRepository;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Result<Boolean, FollowError> follow(UserId followerId, UserId followeeId) {
        var edge = Follow.create(followerId, followeeId, clock.instant());
        if (edge.isFailure()) {
            log.warn("Follow rejected: {} ({})", edge.errorOrNull().code(), followerId);
            return Result.failure(new FollowError.ValidationFailed(edge.errorOrNull()));
        }
        if (!userRepository.existsById(followeeId)) {
            log.debug("Follow target missing: {}", followeeId);
            return Result.failure(new FollowError.UserNotFound(followeeId));
        }

        boolean created = followRepository.save(edge.getOrThrow());
        if (created) {
            metrics.incrementFollows();
            log.info("Follow stored: {} -> {}", followerId, followeeId);
        } else {
            log.debug("Follow already present: {} -> {}", followerId, followeeId);
        }
        return Result.success(created);
    }

    @Override
    @Transactional
    public Result<Boolean, FollowError> unfollow(UserId followerId, UserId followeeId) {
        if (followerId.equals(followeeId)) {
            log.warn("Unfollow rejected: SELF_FOLLOW ({})", followerId);
            return Result.failure(new FollowError.ValidationFailed(FollowValidationError.SelfFollow.INSTANCE));
        }
        if (!userRepository.existsById(followeeId)) {
            log.debug("Unfollow target missing: {}", followeeId);
            return Result.failure(new FollowError.UserNotFound(followeeId));
        }

        boolean removed = followRepository.delete(followerId, followeeId);
        if (removed) {
            metrics.incrementUnfollows();
            log.info("Follow removed: {} -> {}", followerId, followeeId);
        }
        return Result.success(removed);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isFollowing(UserId followerId, UserId followeeId) {
        return followRepository.exists(followerId, followeeId);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<User> getFollowing(UserId userId, FollowCursor after, int limit) {
        return page(followRepository.findFollowing(userId, after, limit + 1), limit);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<User> getFollowers(UserId userId, FollowCursor after, int limit) {
        return page(followRepository.findFollowers(userId, after, limit + 1), limit);
    }

    // rows holds up to limit + 1 edges; the extra one only signals that another page exists
    private static Page<User> page(List<Edge> rows, int limit) {
        if (rows.size() <= limit) {
            return Page.of(rows.stream().map(Edge::user).toList(), null);
        }
        List<Edge> shown = rows.subList(0, limit);
        String next = shown.get(shown.size() - 1).cursor().toString();
        return Page.of(shown.stream().map(Edge::user).toList(), next);
    }
}
