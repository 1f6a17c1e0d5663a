package com.microblog.adapter.out.persistence;

import com.microblog.application.port.out.PostRepository;
import com.microblog.domain.model.Post;
import com.microblog.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcPostRepository implements PostRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Post> ROW_MAPPER = (rs, rowNum) -> new Post(
        rs.getLong("id"),
        UserId.of(rs.getLong("user_id")),
        rs.getString("body"),
        rs.getTimestamp("created_at").toInstant()
    );

    public JdbcPostRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(Post post) {
        jdbc.update("""
            INSERT INTO posts (id, user_id, body, created_at)
            VALUES (?, ?, ?, ?)
            """,
            post.id(),
            post.authorId().value(),
            post.body(),
            Timestamp.from(post.createdAt())
        );
    }

    @Override
    public Optional<Post> findById(long id) {
        return jdbc.query(
            "SELECT id, user_id, body, created_at FROM posts WHERE id = ?",
            ROW_MAPPER,
            id
        ).stream().findFirst();
    }

    @Override
    public List<Post> findByAuthor(UserId authorId, long offset, int limit) {
        return jdbc.query("""
            SELECT id, user_id, body, created_at
            FROM posts
            WHERE user_id = ?
            ORDER BY created_at DESC, id DESC
            LIMIT ? OFFSET ?
            """,
            ROW_MAPPER,
            authorId.value(),
            limit,
            offset
        );
    }

    @Override
    public List<Post> findFeed(UserId userId, long offset, int limit) {
        // UNION (not UNION ALL) keeps each post once even if the user appears among their own followees
        return jdbc.query("""
            SELECT p.id, p.user_id, p.body, p.created_at
            FROM posts p
            JOIN follows f ON f.followee_id = p.user_id
            WHERE f.follower_id = ?
            UNION
            SELECT p.id, p.user_id, p.body, p.created_at
            FROM posts p
            WHERE p.user_id = ?
            ORDER BY created_at DESC, id DESC
            LIMIT ? OFFSET ?
            """,
            ROW_MAPPER,
            userId.value(),
            userId.value(),
            limit,
            offset
        );
    }

    @Override
    public List<Post> findAll(long offset, int limit) {
        return jdbc.query("""
            SELECT id, user_id, body, created_at
            FROM posts
            ORDER BY created_at DESC, id DESC
            LIMIT ? OFFSET ?
            """,
            ROW_MAPPER,
            limit,
            offset
        );
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM posts", Long.class);
        return count != null ? count : 0;
    }
}
