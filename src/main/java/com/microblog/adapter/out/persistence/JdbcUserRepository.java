package com.microblog.adapter.out.persistence;

import com.microblog.application.port.out.UserRepository;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

@Repository
public class JdbcUserRepository implements UserRepository {

    private static final String COLUMNS = "id, username, email, password_hash, about_me, last_seen";

    static final RowMapper<User> ROW_MAPPER = (rs, rowNum) -> new User(
        UserId.of(rs.getLong("id")),
        rs.getString("username"),
        rs.getString("email"),
        rs.getString("password_hash"),
        rs.getString("about_me"),
        rs.getTimestamp("last_seen").toInstant()
    );

    private final JdbcTemplate jdbc;

    public JdbcUserRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean insert(User user) {
        int inserted = jdbc.update("""
            INSERT INTO users (id, username, email, password_hash, about_me, last_seen)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT DO NOTHING
            """,
            user.id().value(),
            user.username(),
            user.email(),
            user.passwordHash(),
            user.aboutMe(),
            Timestamp.from(user.lastSeen())
        );
        return inserted == 1;
    }

    @Override
    public void updateProfile(UserId id, String username, String aboutMe) {
        jdbc.update("UPDATE users SET username = ?, about_me = ? WHERE id = ?", username, aboutMe, id.value());
    }

    @Override
    public void updatePassword(UserId id, String passwordHash) {
        jdbc.update("UPDATE users SET password_hash = ? WHERE id = ?", passwordHash, id.value());
    }

    @Override
    public void touchLastSeen(UserId id, Instant lastSeen) {
        jdbc.update("UPDATE users SET last_seen = ? WHERE id = ?", Timestamp.from(lastSeen), id.value());
    }

    @Override
    public Optional<User> findById(UserId id) {
        return jdbc.query("SELECT " + COLUMNS + " FROM users WHERE id = ?", ROW_MAPPER, id.value())
            .stream().findFirst();
    }

    @Override
    public Optional<User> findByUsername(String username) {
        return jdbc.query("SELECT " + COLUMNS + " FROM users WHERE username = ?", ROW_MAPPER, username)
            .stream().findFirst();
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return jdbc.query("SELECT " + COLUMNS + " FROM users WHERE email = ?", ROW_MAPPER, email)
            .stream().findFirst();
    }

    @Override
    public boolean existsById(UserId id) {
        return exists("id", id.value());
    }

    @Override
    public boolean existsByUsername(String username) {
        return exists("username", username);
    }

    @Override
    public boolean existsByEmail(String email) {
        return exists("email", email);
    }

    // column is always one of the constants above
    private boolean exists(String column, Object value) {
        Boolean exists = jdbc.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM users WHERE " + column + " = ?)",
            Boolean.class,
            value
        );
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM users", Long.class);
        return count != null ? count : 0;
    }
}
