package com.microblog.application.service;

import com.microblog.application.port.in.CredentialUseCase;
import com.microblog.application.port.in.GetUserUseCase;
import com.microblog.application.port.in.RecordActivityUseCase;
import com.microblog.application.port.in.RegisterUserUseCase;
import com.microblog.application.port.in.UpdateProfileUseCase;
import com.microblog.application.port.out.FollowQueryPort;
import com.microblog.application.port.out.FollowQueryPort.FollowCounts;
import com.microblog.application.port.out.IdGenerator;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.UserRepository;
import com.microblog.domain.error.IdentityError;
import com.microblog.domain.error.ValidationError.UserFieldError;
import com.microblog.domain.model.Profile;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

@Service
public class IdentityService implements RegisterUserUseCase, GetUserUseCase, UpdateProfileUseCase, RecordActivityUseCase {

    private static final Logger log = LoggerFactory.getLogger(IdentityService.class);

    private final UserRepository userRepository;
    private final FollowQueryPort followQueryPort;
    private final CredentialUseCase credentials;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final Clock clock;

    public IdentityService(
            UserRepository userRepository,
            FollowQueryPort followQueryPort,
            CredentialUseCase credentials,
            IdGenerator idGenerator,
            MetricsPort metrics,
            Clock clock) {
        this.userRepository = userRepository;
        this.followQueryPort = followQueryPort;
        this.credentials = credentials;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Result<User, IdentityError> register(String username, String email, String password) {
        log.debug("Processing registration: username={}", username);

        if (password == null || password.isBlank()) {
            return Result.failure(new IdentityError.InvalidField(new UserFieldError.Blank("password")));
        }

        var userResult = User.create(UserId.of(idGenerator.nextUserId()), username, email, clock.instant());
        if (userResult.isFailure()) {
            log.warn("Registration rejected: {}", userResult.errorOrNull().message());
            return Result.failure(new IdentityError.InvalidField(userResult.errorOrNull()));
        }
        User user = userResult.getOrThrow();

        // Username is checked first, so a request colliding on both reports the username
        if (userRepository.existsByUsername(user.username())) {
            log.debug("Username already taken: {}", user.username());
            return Result.failure(new IdentityError.DuplicateUsername(user.username()));
        }
        if (userRepository.existsByEmail(user.email())) {
            log.debug("Email already registered for username={}", user.username());
            return Result.failure(new IdentityError.DuplicateEmail(user.email()));
        }

        user = credentials.setPassword(user, password);
        if (!userRepository.insert(user)) {
            // Lost a race against a concurrent registration; the unique constraints decided
            log.warn("Concurrent registration collided: username={}", user.username());
            return userRepository.existsByUsername(user.username())
                ? Result.failure(new IdentityError.DuplicateUsername(user.username()))
                : Result.failure(new IdentityError.DuplicateEmail(user.email()));
        }

        metrics.incrementRegistrations();
        log.info("User registered: id={}, username={}", user.id(), user.username());
        return Result.success(user);
    }

    @Override
    public Optional<User> findById(UserId id) {
        return userRepository.findById(id);
    }

    @Override
    public Optional<User> findByUsername(String username) {
        if (username == null) {
            return Optional.empty();
        }
        return userRepository.findByUsername(username);
    }

    @Override
    public Optional<User> findByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return userRepository.findByEmail(email.trim());
    }

    @Override
    @Transactional(readOnly = true)
    public Result<Profile, IdentityError> getProfile(UserId id) {
        return userRepository.findById(id)
            .<Result<Profile, IdentityError>>map(user -> {
                FollowCounts counts = followQueryPort.countsFor(id);
                return Result.success(new Profile(user, counts.followers(), counts.following()));
            })
            .orElseGet(() -> Result.failure(new IdentityError.IdentityNotFound(id)));
    }

    @Override
    @Transactional
    public Result<User, IdentityError> updateProfile(UserId userId, String newUsername, String newAboutMe) {
        log.debug("Processing profile update: user={}", userId);

        Optional<User> current = userRepository.findById(userId);
        if (current.isEmpty()) {
            return Result.failure(new IdentityError.IdentityNotFound(userId));
        }
        User user = current.get();

        String username = newUsername != null ? newUsername : user.username();
        String aboutMe = newAboutMe != null ? newAboutMe : user.aboutMe();

        UserFieldError fieldError = User.validateUsername(username);
        if (fieldError == null) {
            fieldError = User.validateAboutMe(aboutMe);
        }
        if (fieldError != null) {
            log.warn("Profile update rejected for user={}: {}", userId, fieldError.message());
            return Result.failure(new IdentityError.InvalidField(fieldError));
        }

        if (!username.equals(user.username()) && userRepository.existsByUsername(username)) {
            log.debug("Username unavailable for user={}: {}", userId, username);
            return Result.failure(new IdentityError.UsernameUnavailable(username));
        }

        User updated = user.withProfile(username, aboutMe);
        userRepository.updateProfile(userId, username, aboutMe);
        log.info("Profile updated: user={}, username={}", userId, username);
        return Result.success(updated);
    }

    @Override
    public void touchLastSeen(UserId userId) {
        userRepository.touchLastSeen(userId, clock.instant());
    }
}
