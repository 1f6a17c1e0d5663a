package com.microblog.domain.error;

/**
 * Failures of sign-in and password reset. Unknown users, wrong passwords, forged and expired
 * tokens share one variant each so callers cannot tell them apart.
 */
public sealed interface AuthError {

    record InvalidCredentials() implements AuthError {
        public static final InvalidCredentials INSTANCE = new InvalidCredentials();

        @Override
        public String message() {
            return "Invalid username or password";
        }

        @Override
        public String code() {
            return "INVALID_CREDENTIALS";
        }
    }

    record VerificationFailed() implements AuthError {
        public static final VerificationFailed INSTANCE = new VerificationFailed();

        @Override
        public String message() {
            return "Reset link is invalid or has expired";
        }

        @Override
        public String code() {
            return "VERIFICATION_FAILED";
        }
    }

    record InvalidPassword(String reason) implements AuthError {
        @Override
        public String message() {
            return reason;
        }

        @Override
        public String code() {
            return "PASSWORD_INVALID";
        }
    }

    String message();

    String code();
}
