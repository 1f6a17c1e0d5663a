package com.microblog.adapter.in.web;

import com.microblog.domain.model.Post;

import java.time.Instant;

public record PostResponse(
    long id,
    String authorId,
    String body,
    Instant createdAt
) {
    public static PostResponse from(Post post) {
        return new PostResponse(post.id(), post.authorId().toString(), post.body(), post.createdAt());
    }
}
