package com.microblog.adapter.out.query;

import com.microblog.application.port.out.FollowQueryPort;
import com.microblog.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class FollowQueryAdapter implements FollowQueryPort {

    private final JdbcTemplate jdbc;

    public FollowQueryAdapter(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public FollowCounts countsFor(UserId userId) {
        return jdbc.queryForObject("""
            SELECT
                (SELECT COUNT(*) FROM follows WHERE followee_id = ?) AS followers,
                (SELECT COUNT(*) FROM follows WHERE follower_id = ?) AS following
            """,
            (rs, rowNum) -> new FollowCounts(rs.getLong("followers"), rs.getLong("following")),
            userId.value(),
            userId.value()
        );
    }
}
