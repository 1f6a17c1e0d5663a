package com.microblog.domain.error;

import com.microblog.domain.model.UserId;

/**
 * Expected failures of identity directory operations (registration, profile edits, lookups).
 */
public sealed interface IdentityError {

    record DuplicateUsername(String username) implements IdentityError {
        @Override
        public String message() {
            return "Username already registered: " + username;
        }

        @Override
        public String code() {
            return "DUPLICATE_USERNAME";
        }
    }

    record DuplicateEmail(String email) implements IdentityError {
        @Override
        public String message() {
            return "Email address already registered";
        }

        @Override
        public String code() {
            return "DUPLICATE_EMAIL";
        }
    }

    record UsernameUnavailable(String username) implements IdentityError {
        @Override
        public String message() {
            return "Username not available: " + username;
        }

        @Override
        public String code() {
            return "USERNAME_UNAVAILABLE";
        }
    }

    record IdentityNotFound(UserId userId) implements IdentityError {
        @Override
        public String message() {
            return "User not found: " + userId;
        }

        @Override
        public String code() {
            return "USER_NOT_FOUND";
        }
    }

    record InvalidField(ValidationError error) implements IdentityError {
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
