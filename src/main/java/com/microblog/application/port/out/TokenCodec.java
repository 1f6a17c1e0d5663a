package com.microblog.application.port.out;

import com.microblog.domain.model.UserId;

import java.time.Instant;
import java.util.Optional;

/**
 * Signs and verifies self-contained tokens naming a user. No server-side state is kept.
 */
public interface TokenCodec {

    String sign(UserId subject, TokenPurpose purpose, Instant issuedAt, Instant expiresAt);

    /**
     * @return the subject iff the signature is valid, the purpose matches and {@code now} is before expiry
     */
    Optional<UserId> verify(String token, TokenPurpose purpose, Instant now);

    enum TokenPurpose {
        RESET_PASSWORD("reset_password"),
        SESSION("session");

        private final String claim;

        TokenPurpose(String claim) {
            this.claim = claim;
        }

        public String claim() {
            return claim;
        }
    }
}
