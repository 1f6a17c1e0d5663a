package com.microblog.infrastructure.context;

import com.microblog.domain.model.AnonymousSubject;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RequestContextTest {

    private final User john = new User(UserId.of(1), "john", "john@example.com", "hash", null, Instant.now());

    @AfterEach
    void tearDown() {
        RequestContext.clear();
    }

    @Test
    void shouldExposeSignedInUserAndTagLogs() {
        RequestContext.set(john, "req-1");

        assertEquals(UserId.of(1), RequestContext.getUserId());
        assertTrue(RequestContext.getSubject().isAuthenticated());
        assertEquals("1", RequestContext.getSubject().sessionKey());
        assertEquals("req-1", RequestContext.getRequestId());
        assertEquals("1", MDC.get("userId"));
        assertEquals("req-1", MDC.get("requestId"));
    }

    @Test
    void anonymousRequestHasNoUser() {
        RequestContext.set(john, "req-1");
        RequestContext.clear();

        RequestContext.setAnonymous("req-2");

        assertNull(RequestContext.getUserId());
        assertSame(AnonymousSubject.INSTANCE, RequestContext.getSubject());
        assertTrue(RequestContext.getSubject().isAnonymous());
        assertNull(MDC.get("userId"));
        assertEquals("req-2", MDC.get("requestId"));
    }

    @Test
    void clearRemovesEverything() {
        RequestContext.set(john, "req-1");

        RequestContext.clear();

        assertNull(RequestContext.getUserId());
        assertNull(RequestContext.getRequestId());
        assertNull(MDC.get("requestId"));
    }
}
