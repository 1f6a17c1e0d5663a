package com.microblog.adapter.out.security;

import com.microblog.application.port.out.PasswordHasher;
import com.microblog.infrastructure.config.AppProperties;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder.SecretKeyFactoryAlgorithm;
import org.springframework.stereotype.Component;

/**
 * PBKDF2-HMAC-SHA256 with a random per-password salt. The stored value is hex(salt || derived key).
 */
@Component
public class Pbkdf2PasswordHasher implements PasswordHasher {

    private final Pbkdf2PasswordEncoder encoder;

    public Pbkdf2PasswordHasher(AppProperties appProperties) {
        AppProperties.Security security = appProperties.getSecurity();
        this.encoder = new Pbkdf2PasswordEncoder(
            "", security.getSaltLength(), security.getPbkdf2Iterations(), SecretKeyFactoryAlgorithm.PBKDF2WithHmacSHA256);
    }

    @Override
    public String hash(String plaintext) {
        return encoder.encode(plaintext);
    }

    @Override
    public boolean matches(String plaintext, String hash) {
        return encoder.matches(plaintext, hash);
    }
}
