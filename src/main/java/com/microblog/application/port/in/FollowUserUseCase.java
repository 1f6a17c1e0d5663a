package com.microblog.application.port.in;

import com.microblog.domain.error.FollowError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.UserId;

public interface FollowUserUseCase {

    /**
     * Succeeds with {@code true} if a new edge was stored, {@code false} if it already existed.
     */
    Result<Boolean, FollowError> follow(UserId followerId, UserId followeeId);

    boolean isFollowing(UserId followerId, UserId followeeId);
}
