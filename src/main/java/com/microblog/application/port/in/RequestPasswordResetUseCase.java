package com.microblog.application.port.in;

public interface RequestPasswordResetUseCase {
    /**
     * Mails a reset link if the address belongs to a user. Completes normally either way.
     */
    void requestPasswordReset(String email);
}
