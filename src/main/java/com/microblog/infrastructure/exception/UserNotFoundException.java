package com.microblog.infrastructure.exception;

/**
 * Thrown by lookups that address a user by name rather than by id.
 */
public class UserNotFoundException extends BusinessException {

    private final String username;

    public UserNotFoundException(String username) {
        super("USER_NOT_FOUND", "No user named '" + username + "'");
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}
