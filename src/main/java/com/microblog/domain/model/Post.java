package com.microblog.domain.model;

import com.microblog.domain.error.ValidationError.InvalidBody;

import java.time.Instant;

/**
 * A short text item owned by exactly one user. Posts are totally ordered by
 * {@code (createdAt, id)}, newest first.
 */
public record Post(
    long id,
    UserId authorId,
    String body,
    Instant createdAt
) {
    public static final int MAX_BODY_LENGTH = 140;

    /**
     * Creates a Post, returning a Result for expected validation failures.
     */
    public static Result<Post, InvalidBody> create(long id, UserId authorId, String body, Instant createdAt) {
        if (body == null || body.isBlank()) {
            return Result.failure(InvalidBody.Empty.INSTANCE);
        }
        String trimmed = body.trim();
        if (trimmed.length() > MAX_BODY_LENGTH) {
            return Result.failure(new InvalidBody.TooLong(trimmed.length(), MAX_BODY_LENGTH));
        }
        return Result.success(new Post(id, authorId, trimmed, createdAt));
    }
}
