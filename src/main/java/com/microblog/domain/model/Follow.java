package com.microblog.domain.model;

import com.microblog.domain.error.ValidationError.FollowValidationError;

import java.time.Instant;

/**
 * Directed edge of the social graph: {@code followerId} follows {@code followeeId}.
 * Edges are never updated, only created and removed.
 */
public record Follow(
    UserId followerId,
    UserId followeeId,
    Instant createdAt
) {
    public static Result<Follow, FollowValidationError> create(UserId followerId, UserId followeeId, Instant at) {
        if (followerId.equals(followeeId)) {
            return Result.failure(FollowValidationError.SelfFollow.INSTANCE);
        }
        return Result.success(new Follow(followerId, followeeId, at));
    }
}
