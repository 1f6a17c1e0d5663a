package com.microblog.application.port.out;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementRegistrations();

    void incrementLogins(boolean success);

    void incrementPasswordResets();

    void incrementPostsCreated();

    void incrementFollows();

    void incrementUnfollows();

    void incrementFeedRequests();

    void incrementNotifications(boolean delivered);
}
