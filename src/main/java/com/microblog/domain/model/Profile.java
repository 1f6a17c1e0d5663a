package com.microblog.domain.model;

/**
 * Read model for a user's profile page.
 */
public record Profile(
    User user,
    long followerCount,
    long followingCount
) {
}
