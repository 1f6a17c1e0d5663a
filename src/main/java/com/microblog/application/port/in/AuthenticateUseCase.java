package com.microblog.application.port.in;

import com.microblog.domain.error.AuthError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.Session;
import com.microblog.domain.model.User;

import java.util.Optional;

public interface AuthenticateUseCase {

    Result<Session, AuthError> login(String username, String password);

    /**
     * Resolves a bearer session token to its user and records the user as seen now.
     * Empty for any invalid or expired token, or a token naming a user that no longer exists.
     */
    Optional<User> resolveSession(String token);
}
