package com.microblog.application.port.out;

/**
 * Port for generating unique identifiers.
 * Abstracts ID generation strategy from application services.
 */
public interface IdGenerator {

    /**
     * Next identifier for a new user. Always positive.
     */
    long nextUserId();

    /**
     * Next identifier for a new post. Increases with every call, so id order follows creation order.
     */
    long nextPostId();
}
