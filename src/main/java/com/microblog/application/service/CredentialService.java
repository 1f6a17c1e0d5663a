package com.microblog.application.service;

import com.microblog.application.port.in.CredentialUseCase;
import com.microblog.application.port.out.PasswordHasher;
import com.microblog.application.port.out.TokenCodec;
import com.microblog.application.port.out.TokenCodec.TokenPurpose;
import com.microblog.domain.model.Session;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Service
public class CredentialService implements CredentialUseCase {

    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

    private final PasswordHasher passwordHasher;
    private final TokenCodec tokenCodec;
    private final AppProperties appProperties;
    private final Clock clock;

    public CredentialService(
            PasswordHasher passwordHasher,
            TokenCodec tokenCodec,
            AppProperties appProperties,
            Clock clock) {
        this.passwordHasher = passwordHasher;
        this.tokenCodec = tokenCodec;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    @Override
    public User setPassword(User user, String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Password must not be null");
        }
        return user.withPasswordHash(passwordHasher.hash(plaintext));
    }

    @Override
    public boolean checkPassword(User user, String plaintext) {
        if (plaintext == null || user.passwordHash() == null) {
            return false;
        }
        try {
            return passwordHasher.matches(plaintext, user.passwordHash());
        } catch (IllegalArgumentException e) {
            log.warn("Stored password hash for user={} is unreadable: {}", user.id(), e.getMessage());
            return false;
        }
    }

    @Override
    public String issueResetToken(User user, Duration ttl) {
        Instant now = clock.instant();
        log.debug("Issuing reset token: user={}, ttl={}", user.id(), ttl);
        return tokenCodec.sign(user.id(), TokenPurpose.RESET_PASSWORD, now, now.plus(ttl));
    }

    @Override
    public Optional<UserId> verifyResetToken(String token) {
        return verify(token, TokenPurpose.RESET_PASSWORD);
    }

    @Override
    public Session issueSession(User user) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(appProperties.getSecurity().getSessionTokenTtl());
        String token = tokenCodec.sign(user.id(), TokenPurpose.SESSION, now, expiresAt);
        return new Session(token, user, expiresAt);
    }

    @Override
    public Optional<UserId> verifySessionToken(String token) {
        return verify(token, TokenPurpose.SESSION);
    }

    private Optional<UserId> verify(String token, TokenPurpose purpose) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Optional<UserId> subject = tokenCodec.verify(token, purpose, clock.instant());
        if (subject.isEmpty()) {
            log.debug("Token rejected: purpose={}", purpose.claim());
        }
        return subject;
    }
}
