package com.microblog.adapter.in.web;

import com.microblog.domain.model.User;

import java.time.Instant;

public record UserResponse(
    String id,
    String username,
    String aboutMe,
    Instant lastSeen,
    String avatarUrl
) {
    static final int AVATAR_SIZE = 128;

    public static UserResponse from(User user) {
        return new UserResponse(
            user.id().toString(),
            user.username(),
            user.aboutMe(),
            user.lastSeen(),
            user.avatar(AVATAR_SIZE)
        );
    }
}
