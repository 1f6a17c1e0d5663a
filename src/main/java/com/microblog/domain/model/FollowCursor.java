package com.microblog.domain.model;

import com.microblog.domain.error.ValidationError;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Keyset position in a follower or following list, ordered by follow time then user id,
 * both descending. Rendered as {@code <instant>_<userId>}.
 */
public record FollowCursor(Instant followedAt, UserId userId) {

    private static final char SEPARATOR = '_';

    public static Result<FollowCursor, ValidationError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(new ValidationError.MalformedCursor(String.valueOf(value)));
        }
        int split = value.lastIndexOf(SEPARATOR);
        if (split <= 0) {
            return Result.failure(new ValidationError.MalformedCursor(value));
        }
        try {
            Instant followedAt = Instant.parse(value.substring(0, split));
            var userId = UserId.parse(value.substring(split + 1));
            if (userId.isFailure()) {
                return Result.failure(new ValidationError.MalformedCursor(value));
            }
            return Result.success(new FollowCursor(followedAt, userId.getOrThrow()));
        } catch (DateTimeParseException e) {
            return Result.failure(new ValidationError.MalformedCursor(value));
        }
    }

    @Override
    public String toString() {
        return followedAt.toString() + SEPARATOR + userId;
    }
}
