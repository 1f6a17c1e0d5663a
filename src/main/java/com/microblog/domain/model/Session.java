package com.microblog.domain.model;

import java.time.Instant;

/**
 * A signed-in session: the bearer token the caller presents and the user it names.
 */
public record Session(
    String token,
    User user,
    Instant expiresAt
) {
}
