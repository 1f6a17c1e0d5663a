package com.microblog.domain.model;

/**
 * Who is making the current request, as seen by the session layer.
 * Implemented by {@link User} for signed-in callers and by {@link AnonymousSubject} otherwise.
 */
public interface SessionSubject {

    boolean isAuthenticated();

    /**
     * Stable key the session layer stores to find the subject again; {@code null} when anonymous.
     */
    String sessionKey();

    default boolean isAnonymous() {
        return !isAuthenticated();
    }
}
