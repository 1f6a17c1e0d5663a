package com.microblog.adapter.out.persistence;

import com.microblog.application.port.out.FollowRepository;
import com.microblog.domain.model.Follow;
import com.microblog.domain.model.FollowCursor;
import com.microblog.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

@Repository
public class JdbcFollowRepository implements FollowRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Edge> EDGE_ROW_MAPPER = (rs, rowNum) -> new Edge(
        JdbcUserRepository.ROW_MAPPER.mapRow(rs, rowNum),
        rs.getTimestamp("followed_at").toInstant()
    );

    // first %s: edge column joined to users, second %s: edge column holding the listed user
    private static final String EDGE_QUERY = """
        SELECT u.id, u.username, u.email, u.password_hash, u.about_me, u.last_seen,
               f.created_at AS followed_at
        FROM follows f
        JOIN users u ON u.id = f.%s
        WHERE f.%s = ?
        """;

    private static final String AFTER_CURSOR = "  AND (f.created_at, u.id) < (?, ?)\n";

    private static final String ORDER_AND_LIMIT = "ORDER BY f.created_at DESC, u.id DESC\nLIMIT ?";

    public JdbcFollowRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean save(Follow follow) {
        int inserted = jdbc.update("""
            INSERT INTO follows (follower_id, followee_id, created_at)
            VALUES (?, ?, ?)
            ON CONFLICT (follower_id, followee_id) DO NOTHING
            """,
            follow.followerId().value(),
            follow.followeeId().value(),
            Timestamp.from(follow.createdAt())
        );
        return inserted == 1;
    }

    @Override
    public boolean delete(UserId followerId, UserId followeeId) {
        int deleted = jdbc.update(
            "DELETE FROM follows WHERE follower_id = ? AND followee_id = ?",
            followerId.value(),
            followeeId.value()
        );
        return deleted == 1;
    }

    @Override
    public boolean exists(UserId followerId, UserId followeeId) {
        Boolean exists = jdbc.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM follows WHERE follower_id = ? AND followee_id = ?)",
            Boolean.class,
            followerId.value(),
            followeeId.value()
        );
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public List<Edge> findFollowing(UserId userId, FollowCursor after, int limit) {
        return findEdges("followee_id", "follower_id", userId, after, limit);
    }

    @Override
    public List<Edge> findFollowers(UserId userId, FollowCursor after, int limit) {
        return findEdges("follower_id", "followee_id", userId, after, limit);
    }

    private List<Edge> findEdges(String otherSide, String listedSide, UserId userId, FollowCursor after, int limit) {
        String select = EDGE_QUERY.formatted(otherSide, listedSide);
        if (after == null) {
            return jdbc.query(select + ORDER_AND_LIMIT, EDGE_ROW_MAPPER, userId.value(), limit);
        }
        return jdbc.query(
            select + AFTER_CURSOR + ORDER_AND_LIMIT,
            EDGE_ROW_MAPPER,
            userId.value(),
            Timestamp.from(after.followedAt()),
            after.userId().value(),
            limit
        );
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM follows", Long.class);
        return count != null ? count : 0;
    }
}
