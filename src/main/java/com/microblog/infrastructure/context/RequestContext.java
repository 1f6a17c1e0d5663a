package com.microblog.infrastructure.context;

import com.microblog.domain.model.AnonymousSubject;
import com.microblog.domain.model.SessionSubject;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import org.slf4j.MDC;

/**
 * Per-request state bound by {@code AuthFilter}: the signed-in user, if any, and the request id.
 * Both ids are mirrored into the logging MDC.
 */
public final class RequestContext {

    private static final String MDC_USER = "userId";
    private static final String MDC_REQUEST = "requestId";

    private record Scope(User user, String requestId) {}

    private static final ThreadLocal<Scope> SCOPE = new ThreadLocal<>();

    private RequestContext() {}

    public static void set(User user, String requestId) {
        SCOPE.set(new Scope(user, requestId));
        MDC.put(MDC_USER, user.id().toString());
        MDC.put(MDC_REQUEST, requestId);
    }

    public static void setAnonymous(String requestId) {
        SCOPE.set(new Scope(null, requestId));
        MDC.remove(MDC_USER);
        MDC.put(MDC_REQUEST, requestId);
    }

    public static SessionSubject getSubject() {
        User user = user();
        return user == null ? AnonymousSubject.INSTANCE : user;
    }

    /**
     * Id of the signed-in user, or {@code null} on public paths.
     */
    public static UserId getUserId() {
        User user = user();
        return user == null ? null : user.id();
    }

    public static String getRequestId() {
        Scope scope = SCOPE.get();
        return scope == null ? null : scope.requestId();
    }

    public static void clear() {
        SCOPE.remove();
        MDC.remove(MDC_USER);
        MDC.remove(MDC_REQUEST);
    }

    private static User user() {
        Scope scope = SCOPE.get();
        return scope == null ? null : scope.user();
    }
}
