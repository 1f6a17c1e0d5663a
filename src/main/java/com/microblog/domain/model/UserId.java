package com.microblog.domain.model;

import com.microblog.domain.error.ValidationError.UserIdError;

/**
 * Value Object for user identity.
 * Wraps the numeric database id so ids of different entities cannot be mixed up.
 */
public record UserId(long value) {

    public UserId {
        if (value <= 0) {
            throw new IllegalStateException("UserId must be positive - use parse() for validation: " + value);
        }
    }

    /**
     * Parses external input (path variables, token subjects) into a UserId.
     */
    public static Result<UserId, UserIdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(UserIdError.Empty.INSTANCE);
        }
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed <= 0) {
                return Result.failure(new UserIdError.InvalidFormat(value));
            }
            return Result.success(new UserId(parsed));
        } catch (NumberFormatException e) {
            return Result.failure(new UserIdError.InvalidFormat(value));
        }
    }

    public static UserId of(long value) {
        return new UserId(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
