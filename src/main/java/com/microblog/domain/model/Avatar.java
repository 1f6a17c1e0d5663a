package com.microblog.domain.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Derives avatar references from email addresses. Pure function of (normalized email, size).
 */
public final class Avatar {

    private static final String GRAVATAR_BASE = "https://www.gravatar.com/avatar/";
    private static final String DEFAULT_IMAGE = "monsterid";

    private Avatar() {}

    public static String gravatarUrl(String email, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Avatar size must be positive: " + size);
        }
        return GRAVATAR_BASE + emailDigest(email) + "?d=" + DEFAULT_IMAGE + "&s=" + size;
    }

    /**
     * Hex MD5 of the trimmed, lower-cased email (Gravatar's addressing scheme).
     */
    public static String emailDigest(String email) {
        String normalized = email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(normalized.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship MD5
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
