package com.microblog.application.port.in;

import com.microblog.domain.error.FollowError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.UserId;

public interface UnfollowUserUseCase {

    /**
     * Succeeds with {@code true} if an edge was removed, {@code false} if there was none.
     */
    Result<Boolean, FollowError> unfollow(UserId followerId, UserId followeeId);
}
