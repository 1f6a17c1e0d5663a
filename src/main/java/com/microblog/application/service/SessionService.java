package com.microblog.application.service;

import com.microblog.application.port.in.AuthenticateUseCase;
import com.microblog.application.port.in.CredentialUseCase;
import com.microblog.application.port.in.RecordActivityUseCase;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.UserRepository;
import com.microblog.domain.error.AuthError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.Session;
import com.microblog.domain.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

@Service
public class SessionService implements AuthenticateUseCase {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final UserRepository userRepository;
    private final CredentialUseCase credentials;
    private final RecordActivityUseCase activity;
    private final MetricsPort metrics;
    private final Clock clock;

    public SessionService(
            UserRepository userRepository,
            CredentialUseCase credentials,
            RecordActivityUseCase activity,
            MetricsPort metrics,
            Clock clock) {
        this.userRepository = userRepository;
        this.credentials = credentials;
        this.activity = activity;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Result<Session, AuthError> login(String username, String password) {
        Optional<User> user = username == null ? Optional.empty() : userRepository.findByUsername(username);
        if (user.isEmpty() || !credentials.checkPassword(user.get(), password)) {
            metrics.incrementLogins(false);
            log.warn("Login failed for username={}", username);
            return Result.failure(AuthError.InvalidCredentials.INSTANCE);
        }

        Session session = credentials.issueSession(user.get());
        metrics.incrementLogins(true);
        log.info("Login succeeded: user={}", user.get().id());
        return Result.success(session);
    }

    @Override
    public Optional<User> resolveSession(String token) {
        return credentials.verifySessionToken(token)
            .flatMap(userRepository::findById)
            .map(user -> {
                activity.touchLastSeen(user.id());
                return user.withLastSeen(clock.instant());
            });
    }
}
