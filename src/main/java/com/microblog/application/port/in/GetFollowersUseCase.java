package com.microblog.application.port.in;

import com.microblog.domain.model.FollowCursor;
import com.microblog.domain.model.Page;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;

public interface GetFollowersUseCase {

    /**
     * @param after cursor of the previous page, {@code null} for the first
     */
    Page<User> getFollowers(UserId userId, FollowCursor after, int limit);
}
