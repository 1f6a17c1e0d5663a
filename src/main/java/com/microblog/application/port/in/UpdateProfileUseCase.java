package com.microblog.application.port.in;

import com.microblog.domain.error.IdentityError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;

public interface UpdateProfileUseCase {
    /**
     * Applies the non-null fields; a {@code null} argument leaves that field as it is.
     */
    Result<User, IdentityError> updateProfile(UserId userId, String newUsername, String newAboutMe);
}
