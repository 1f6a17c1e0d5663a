package com.microblog.application.port.in;

import com.microblog.domain.error.AuthError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;

public interface ResetPasswordUseCase {
    Result<User, AuthError> resetPassword(String token, String newPassword);
}
