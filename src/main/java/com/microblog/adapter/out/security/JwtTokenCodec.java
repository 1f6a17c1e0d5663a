package com.microblog.adapter.out.security;

import com.microblog.application.port.out.TokenCodec;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.config.AppProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * HS256-signed JWTs. The HMAC key is the SHA-256 of the configured secret, so secrets of any
 * length yield a full-strength key.
 */
@Component
public class JwtTokenCodec implements TokenCodec {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenCodec.class);

    static final String PURPOSE_CLAIM = "purpose";

    private final SecretKey key;

    public JwtTokenCodec(AppProperties appProperties) {
        String secret = appProperties.getSecurity().getSecretKey();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("app.security.secret-key must be set");
        }
        this.key = Keys.hmacShaKeyFor(sha256(secret));
    }

    @Override
    public String sign(UserId subject, TokenPurpose purpose, Instant issuedAt, Instant expiresAt) {
        return Jwts.builder()
            .subject(subject.toString())
            .claim(PURPOSE_CLAIM, purpose.claim())
            .issuedAt(Date.from(issuedAt))
            .expiration(Date.from(expiresAt))
            .signWith(key, Jwts.SIG.HS256)
            .compact();
    }

    @Override
    public Optional<UserId> verify(String token, TokenPurpose purpose, Instant now) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(now))
                .build()
                .parseSignedClaims(token)
                .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getClass().getSimpleName());
            return Optional.empty();
        }

        if (!purpose.claim().equals(claims.get(PURPOSE_CLAIM, String.class))) {
            log.debug("Token rejected: purpose mismatch, expected {}", purpose.claim());
            return Optional.empty();
        }
        // exp is stored in whole seconds; a token is only valid strictly before it
        Date expiration = claims.getExpiration();
        if (expiration == null || !now.isBefore(expiration.toInstant())) {
            return Optional.empty();
        }

        var subject = UserId.parse(claims.getSubject());
        if (subject.isFailure()) {
            log.debug("Token rejected: {}", subject.errorOrNull().message());
            return Optional.empty();
        }
        return Optional.of(subject.getOrThrow());
    }

    private static byte[] sha256(String secret) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
