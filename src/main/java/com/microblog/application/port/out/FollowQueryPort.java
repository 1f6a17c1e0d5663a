package com.microblog.application.port.out;

import com.microblog.domain.model.UserId;

/**
 * Read-side query for the social graph, used by the profile page.
 */
public interface FollowQueryPort {

    /**
     * Both counts read in one statement; zero for an unknown user.
     */
    FollowCounts countsFor(UserId userId);

    record FollowCounts(long followers, long following) {}
}
