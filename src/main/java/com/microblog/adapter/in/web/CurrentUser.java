package com.microblog.adapter.in.web;

import com.microblog.domain.model.SessionSubject;
import com.microblog.infrastructure.context.RequestContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Path guard for routes that act on behalf of the signed-in user.
 */
final class CurrentUser {

    private CurrentUser() {}

    /**
     * Returns a 403 response if the path user is not the authenticated user, otherwise {@code null}.
     */
    static ResponseEntity<ErrorResponse> requireMatch(String userId) {
        SessionSubject subject = RequestContext.getSubject();
        if (subject.isAnonymous() || !subject.sessionKey().equals(userId)) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(new ErrorResponse("FORBIDDEN", "User ID in path must match authenticated user", RequestContext.getRequestId()));
        }
        return null;
    }
}
