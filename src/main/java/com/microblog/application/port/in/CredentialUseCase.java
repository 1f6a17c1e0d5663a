package com.microblog.application.port.in;

import com.microblog.domain.model.Session;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;

import java.time.Duration;
import java.util.Optional;

/**
 * Password hashing and signed token mechanics. Verification never throws: every
 * malformed, forged, expired or wrong-purpose token is simply absent.
 */
public interface CredentialUseCase {

    /**
     * Returns a copy of the user carrying a fresh salted hash of {@code plaintext}. The caller persists it.
     */
    User setPassword(User user, String plaintext);

    boolean checkPassword(User user, String plaintext);

    String issueResetToken(User user, Duration ttl);

    Optional<UserId> verifyResetToken(String token);

    Session issueSession(User user);

    Optional<UserId> verifySessionToken(String token);
}
