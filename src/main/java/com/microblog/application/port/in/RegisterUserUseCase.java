package com.microblog.application.port.in;

import com.microblog.domain.error.IdentityError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;

public interface RegisterUserUseCase {
    Result<User, IdentityError> register(String username, String email, String password);
}
