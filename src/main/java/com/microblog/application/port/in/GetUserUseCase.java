package com.microblog.application.port.in;

import com.microblog.domain.error.IdentityError;
import com.microblog.domain.model.Profile;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;

import java.util.Optional;

public interface GetUserUseCase {
    Optional<User> findById(UserId id);

    Optional<User> findByUsername(String username);

    Optional<User> findByEmail(String email);

    Result<Profile, IdentityError> getProfile(UserId id);
}
