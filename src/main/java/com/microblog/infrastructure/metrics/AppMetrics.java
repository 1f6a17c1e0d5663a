package com.microblog.infrastructure.metrics;

import com.microblog.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class AppMetrics implements MetricsPort {

    private final Counter registrations;
    private final Counter loginsSucceeded;
    private final Counter loginsFailed;
    private final Counter passwordResets;
    private final Counter postsCreated;
    private final Counter followsCreated;
    private final Counter unfollows;
    private final Counter feedRequests;
    private final Counter notificationsDelivered;
    private final Counter notificationsFailed;

    public AppMetrics(MeterRegistry registry) {
        this.registrations = Counter.builder("users_registered_total")
            .description("Total number of registered users")
            .register(registry);

        this.loginsSucceeded = Counter.builder("logins_total")
            .description("Login attempts by outcome")
            .tag("outcome", "success")
            .register(registry);

        this.loginsFailed = Counter.builder("logins_total")
            .description("Login attempts by outcome")
            .tag("outcome", "failure")
            .register(registry);

        this.passwordResets = Counter.builder("password_resets_total")
            .description("Total number of completed password resets")
            .register(registry);

        this.postsCreated = Counter.builder("posts_created_total")
            .description("Total number of posts created")
            .register(registry);

        this.followsCreated = Counter.builder("follows_created_total")
            .description("Total number of follow actions")
            .register(registry);

        this.unfollows = Counter.builder("unfollows_total")
            .description("Total number of unfollow actions")
            .register(registry);

        this.feedRequests = Counter.builder("feed_requests_total")
            .description("Total number of feed requests")
            .register(registry);

        this.notificationsDelivered = Counter.builder("notifications_total")
            .description("Outbound notifications by outcome")
            .tag("outcome", "delivered")
            .register(registry);

        this.notificationsFailed = Counter.builder("notifications_total")
            .description("Outbound notifications by outcome")
            .tag("outcome", "failed")
            .register(registry);
    }

    @Override
    public void incrementRegistrations() {
        registrations.increment();
    }

    @Override
    public void incrementLogins(boolean success) {
        (success ? loginsSucceeded : loginsFailed).increment();
    }

    @Override
    public void incrementPasswordResets() {
        passwordResets.increment();
    }

    @Override
    public void incrementPostsCreated() {
        postsCreated.increment();
    }

    @Override
    public void incrementFollows() {
        followsCreated.increment();
    }

    @Override
    public void incrementUnfollows() {
        unfollows.increment();
    }

    @Override
    public void incrementFeedRequests() {
        feedRequests.increment();
    }

    @Override
    public void incrementNotifications(boolean delivered) {
        (delivered ? notificationsDelivered : notificationsFailed).increment();
    }
}
