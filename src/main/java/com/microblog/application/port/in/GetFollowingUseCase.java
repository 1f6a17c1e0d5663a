package com.microblog.application.port.in;

import com.microblog.domain.model.FollowCursor;
import com.microblog.domain.model.Page;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;

public interface GetFollowingUseCase {

    /**
     * @param after position returned with the previous page, or {@code null} for the first page
     */
    Page<User> getFollowing(UserId userId, FollowCursor after, int limit);
}
