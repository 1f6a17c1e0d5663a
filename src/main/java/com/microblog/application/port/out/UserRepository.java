package com.microblog.application.port.out;

import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;

import java.time.Instant;
import java.util.Optional;

public interface UserRepository {

    /**
     * Inserts the user unless the username or email is already taken.
     *
     * @return false if a uniqueness constraint prevented the insert
     */
    boolean insert(User user);

    /**
     * Writes username and about-me only. Last writer wins.
     */
    void updateProfile(UserId id, String username, String aboutMe);

    /**
     * Writes the password hash only, so a concurrent profile edit cannot restore an old one.
     */
    void updatePassword(UserId id, String passwordHash);

    void touchLastSeen(UserId id, Instant lastSeen);

    Optional<User> findById(UserId id);
    Optional<User> findByUsername(String username);
    Optional<User> findByEmail(String email);

    boolean existsById(UserId id);
    boolean existsByUsername(String username);
    boolean existsByEmail(String email);
    long count();
}
