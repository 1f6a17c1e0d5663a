package com.microblog.domain.error;

/**
 * Sealed type representing domain validation errors.
 * These are expected business outcomes, not exceptional cases.
 */
public sealed interface ValidationError {

    String message();

    String code();

    // UserId validation errors
    sealed interface UserIdError extends ValidationError {

        record Empty() implements UserIdError {
            public static final Empty INSTANCE = new Empty();
            @Override
            public String message() {
                return "User ID cannot be empty";
            }

            @Override
            public String code() {
                return "USER_ID_EMPTY";
            }
        }

        record InvalidFormat(String value) implements UserIdError {
            @Override
            public String message() {
                return "User ID must be a positive number: " + value;
            }

            @Override
            public String code() {
                return "USER_ID_INVALID_FORMAT";
            }
        }
    }

    // Registration and profile field errors
    sealed interface UserFieldError extends ValidationError {

        record Blank(String field) implements UserFieldError {
            @Override
            public String message() {
                return field + " cannot be empty";
            }

            @Override
            public String code() {
                return "FIELD_REQUIRED";
            }
        }

        record TooLong(String field, int length, int maxLength) implements UserFieldError {
            @Override
            public String message() {
                return field + " exceeds " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "FIELD_TOO_LONG";
            }
        }

        record MalformedEmail(String value) implements UserFieldError {
            @Override
            public String message() {
                return "Not a valid email address: " + value;
            }

            @Override
            public String code() {
                return "EMAIL_INVALID";
            }
        }
    }

    // Post body errors
    sealed interface InvalidBody extends ValidationError {

        record Empty() implements InvalidBody {
            public static final Empty INSTANCE = new Empty();
            @Override
            public String message() {
                return "Post body cannot be empty";
            }

            @Override
            public String code() {
                return "POST_BODY_EMPTY";
            }
        }

        record TooLong(int length, int maxLength) implements InvalidBody {
            @Override
            public String message() {
                return "Post body exceeds " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "POST_BODY_TOO_LONG";
            }
        }
    }

    record MalformedCursor(String value) implements ValidationError {
        @Override
        public String message() {
            return "Pagination cursor is not valid: " + value;
        }

        @Override
        public String code() {
            return "INVALID_CURSOR";
        }
    }

    sealed interface FollowValidationError extends ValidationError {

        record SelfFollow() implements FollowValidationError {
            public static final SelfFollow INSTANCE = new SelfFollow();
            @Override
            public String message() {
                return "Cannot follow or unfollow yourself";
            }

            @Override
            public String code() {
                return "SELF_FOLLOW";
            }
        }
    }
}
