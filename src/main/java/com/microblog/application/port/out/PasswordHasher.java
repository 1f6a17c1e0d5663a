package com.microblog.application.port.out;

public interface PasswordHasher {

    /**
     * Salted one-way hash; two calls with the same plaintext give different hashes.
     */
    String hash(String plaintext);

    /**
     * Constant-time check of a plaintext against a stored hash.
     *
     * @throws IllegalArgumentException if the stored hash is not in a format this hasher produces
     */
    boolean matches(String plaintext, String hash);
}
