package com.microblog.application.port.out;

import com.microblog.domain.model.Post;
import com.microblog.domain.model.UserId;

import java.util.List;
import java.util.Optional;

/**
 * Post storage. Every list query orders by {@code created_at DESC, id DESC}.
 */
public interface PostRepository {
    void save(Post post);
    Optional<Post> findById(long id);
    List<Post> findByAuthor(UserId authorId, long offset, int limit);

    /**
     * Posts written by the user or by anyone the user follows, each post at most once.
     */
    List<Post> findFeed(UserId userId, long offset, int limit);

    List<Post> findAll(long offset, int limit);
    long count();
}
