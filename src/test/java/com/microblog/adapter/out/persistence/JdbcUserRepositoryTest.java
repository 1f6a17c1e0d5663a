package com.microblog.adapter.out.persistence;

import com.microblog.application.port.out.IdGenerator;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import com.microblog.integration.base.FullStackTestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@EnabledIf("isDockerAvailable")
class JdbcUserRepositoryTest extends FullStackTestBase {

    @Autowired
    private JdbcUserRepository repository;

    @Autowired
    private IdGenerator idGenerator;

    private User newUser(String username, String email) {
        return new User(UserId.of(idGenerator.nextUserId()), username, email, "hash", null,
            Instant.now().truncatedTo(ChronoUnit.MILLIS));
    }

    @Test
    void shouldInsertAndFindUser() {
        // Given
        User john = newUser("john", "john@example.com");

        // When
        boolean inserted = repository.insert(john);

        // Then
        assertTrue(inserted);
        Optional<User> byId = repository.findById(john.id());
        assertTrue(byId.isPresent());
        assertEquals("john", byId.get().username());
        assertEquals("hash", byId.get().passwordHash());
        assertEquals(john.id(), repository.findByUsername("john").orElseThrow().id());
        assertEquals(john.id(), repository.findByEmail("john@example.com").orElseThrow().id());
    }

    @Test
    void shouldReturnEmptyWhenUserNotFound() {
        assertTrue(repository.findById(UserId.of(987654)).isEmpty());
        assertTrue(repository.findByUsername("nobody").isEmpty());
    }

    @Test
    void duplicateUsernameIsNotInserted() {
        // Given
        repository.insert(newUser("susan", "susan@example.com"));

        // When
        boolean inserted = repository.insert(newUser("susan", "other@example.com"));

        // Then
        assertFalse(inserted);
        assertEquals(1, repository.count());
    }

    @Test
    void duplicateEmailIsNotInserted() {
        // Given
        repository.insert(newUser("susan", "susan@example.com"));

        // When
        boolean inserted = repository.insert(newUser("mary", "susan@example.com"));

        // Then
        assertFalse(inserted);
        assertFalse(repository.existsByUsername("mary"));
        assertTrue(repository.existsByEmail("susan@example.com"));
    }

    @Test
    void profileUpdateLeavesPasswordHashAlone() {
        // Given a password reset lands after the profile editor read the user
        User john = newUser("john", "john@example.com");
        repository.insert(john);
        User staleSnapshot = repository.findById(john.id()).orElseThrow();
        repository.updatePassword(john.id(), "reset-hash");

        // When
        repository.updateProfile(staleSnapshot.id(), "johnny", "about me");

        // Then
        User found = repository.findById(john.id()).orElseThrow();
        assertEquals("johnny", found.username());
        assertEquals("about me", found.aboutMe());
        assertEquals("reset-hash", found.passwordHash());
        assertFalse(repository.existsByUsername("john"));
    }

    @Test
    void passwordUpdateLeavesProfileAlone() {
        // Given
        User john = newUser("john", "john@example.com");
        repository.insert(john);
        repository.updateProfile(john.id(), "johnny", "bio");

        // When
        repository.updatePassword(john.id(), "new-hash");

        // Then
        User found = repository.findById(john.id()).orElseThrow();
        assertEquals("new-hash", found.passwordHash());
        assertEquals("johnny", found.username());
        assertEquals("bio", found.aboutMe());
    }

    @Test
    void shouldTouchLastSeen() {
        // Given
        User john = newUser("john", "john@example.com");
        repository.insert(john);
        Instant later = john.lastSeen().plus(1, ChronoUnit.HOURS);

        // When
        repository.touchLastSeen(john.id(), later);

        // Then
        assertEquals(later, repository.findById(john.id()).orElseThrow().lastSeen());
    }
}
