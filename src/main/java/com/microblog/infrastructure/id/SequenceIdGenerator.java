package com.microblog.infrastructure.id;

import com.microblog.application.port.out.IdGenerator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Draws ids from database sequences, so ids stay unique across application instances
 * and are known before the row is written.
 */
@Component
public class SequenceIdGenerator implements IdGenerator {

    private final JdbcTemplate jdbc;

    public SequenceIdGenerator(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public long nextUserId() {
        return next("user_id_seq");
    }

    @Override
    public long nextPostId() {
        return next("post_id_seq");
    }

    private long next(String sequence) {
        Long value = jdbc.queryForObject("SELECT nextval('" + sequence + "')", Long.class);
        if (value == null) {
            throw new IllegalStateException("Sequence " + sequence + " returned no value");
        }
        return value;
    }
}
