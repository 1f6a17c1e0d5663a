package com.microblog.domain.model;

import com.microblog.domain.error.ValidationError.UserFieldError;

import java.time.Instant;

/**
 * A registered identity. The password hash is opaque: it is only ever produced and checked
 * by the credential store, and it is left out of {@link #toString()}.
 */
public record User(
    UserId id,
    String username,
    String email,
    String passwordHash,
    String aboutMe,
    Instant lastSeen
) implements SessionSubject {

    public static final int MAX_USERNAME_LENGTH = 64;
    public static final int MAX_EMAIL_LENGTH = 120;
    public static final int MAX_ABOUT_ME_LENGTH = 140;

    /**
     * Creates a user without a password hash; the credential store sets it before the user is saved.
     */
    public static Result<User, UserFieldError> create(UserId id, String username, String email, Instant lastSeen) {
        var usernameCheck = validateUsername(username);
        if (usernameCheck != null) {
            return Result.failure(usernameCheck);
        }
        if (email == null || email.isBlank()) {
            return Result.failure(new UserFieldError.Blank("email"));
        }
        String trimmedEmail = email.trim();
        if (trimmedEmail.length() > MAX_EMAIL_LENGTH) {
            return Result.failure(new UserFieldError.TooLong("email", trimmedEmail.length(), MAX_EMAIL_LENGTH));
        }
        if (trimmedEmail.indexOf('@') <= 0 || trimmedEmail.endsWith("@")) {
            return Result.failure(new UserFieldError.MalformedEmail(trimmedEmail));
        }
        return Result.success(new User(id, username, trimmedEmail, null, null, lastSeen));
    }

    /**
     * Returns the validation error for a candidate username, or {@code null} if it is acceptable.
     * Usernames are case-sensitive and are not trimmed.
     */
    public static UserFieldError validateUsername(String username) {
        if (username == null || username.isBlank()) {
            return new UserFieldError.Blank("username");
        }
        if (username.length() > MAX_USERNAME_LENGTH) {
            return new UserFieldError.TooLong("username", username.length(), MAX_USERNAME_LENGTH);
        }
        return null;
    }

    public static UserFieldError validateAboutMe(String aboutMe) {
        if (aboutMe != null && aboutMe.length() > MAX_ABOUT_ME_LENGTH) {
            return new UserFieldError.TooLong("aboutMe", aboutMe.length(), MAX_ABOUT_ME_LENGTH);
        }
        return null;
    }

    public User withPasswordHash(String newPasswordHash) {
        return new User(id, username, email, newPasswordHash, aboutMe, lastSeen);
    }

    public User withProfile(String newUsername, String newAboutMe) {
        return new User(id, newUsername, email, passwordHash, newAboutMe, lastSeen);
    }

    public User withLastSeen(Instant newLastSeen) {
        return new User(id, username, email, passwordHash, aboutMe, newLastSeen);
    }

    /**
     * Gravatar URL for this user's email at the given pixel size.
     */
    public String avatar(int size) {
        return Avatar.gravatarUrl(email, size);
    }

    @Override
    public boolean isAuthenticated() {
        return true;
    }

    @Override
    public String sessionKey() {
        return id.toString();
    }

    @Override
    public String toString() {
        return "User[id=" + id + ", username=" + username + "]";
    }
}
