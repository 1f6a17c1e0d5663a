package com.microblog.domain.error;

import com.microblog.domain.model.UserId;

/**
 * Sealed type representing expected business errors for follow operations at the application layer.
 * Following twice or unfollowing a user who is not followed are not errors: both are no-ops.
 */
public sealed interface FollowError {

    record UserNotFound(UserId userId) implements FollowError {
        @Override
        public String message() {
            return "User not found: " + userId;
        }

        @Override
        public String code() {
            return "USER_NOT_FOUND";
        }
    }

    /**
     * Wraps a domain validation error that occurred during follow creation.
     */
    record ValidationFailed(ValidationError error) implements FollowError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }
    }

    String message();

    String code();
}
