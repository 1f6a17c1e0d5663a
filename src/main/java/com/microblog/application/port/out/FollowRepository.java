package com.microblog.application.port.out;

import com.microblog.domain.model.Follow;
import com.microblog.domain.model.FollowCursor;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;

import java.time.Instant;
import java.util.List;

/**
 * The follows edge table. Each (follower, followee) pair is stored at most once.
 */
public interface FollowRepository {

    /**
     * @return false if the edge was already there
     */
    boolean save(Follow follow);

    /**
     * @return false if there was no edge to remove
     */
    boolean delete(UserId followerId, UserId followeeId);

    boolean exists(UserId followerId, UserId followeeId);

    /**
     * Users {@code userId} follows, newest edge first, strictly after {@code after} when given.
     */
    List<Edge> findFollowing(UserId userId, FollowCursor after, int limit);

    /**
     * Users following {@code userId}, newest edge first, strictly after {@code after} when given.
     */
    List<Edge> findFollowers(UserId userId, FollowCursor after, int limit);

    /**
     * The user on the far side of an edge and when the edge was created.
     */
    record Edge(User user, Instant followedAt) {

        public FollowCursor cursor() {
            return new FollowCursor(followedAt, user.id());
        }
    }

    long count();

}
