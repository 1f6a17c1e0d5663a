package com.microblog.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Security security = new Security();
    private Feed feed = new Feed();
    private Mail mail = new Mail();
    private Notification notification = new Notification();

    public Security getSecurity() {
        return security;
    }

    public void setSecurity(Security security) {
        this.security = security;
    }

    public Feed getFeed() {
        return feed;
    }

    public void setFeed(Feed feed) {
        this.feed = feed;
    }

    public Mail getMail() {
        return mail;
    }

    public void setMail(Mail mail) {
        this.mail = mail;
    }

    public Notification getNotification() {
        return notification;
    }

    public void setNotification(Notification notification) {
        this.notification = notification;
    }

    public static class Security {
        /** Token signing secret. Fixed for the lifetime of the process. */
        private String secretKey;
        private Duration resetTokenTtl = Duration.ofSeconds(600);
        private Duration sessionTokenTtl = Duration.ofHours(24);
        private int pbkdf2Iterations = 310_000;
        private int saltLength = 16;

        public String getSecretKey() {
            return secretKey;
        }

        public void setSecretKey(String secretKey) {
            this.secretKey = secretKey;
        }

        public Duration getResetTokenTtl() {
            return resetTokenTtl;
        }

        public void setResetTokenTtl(Duration resetTokenTtl) {
            this.resetTokenTtl = resetTokenTtl;
        }

        public Duration getSessionTokenTtl() {
            return sessionTokenTtl;
        }

        public void setSessionTokenTtl(Duration sessionTokenTtl) {
            this.sessionTokenTtl = sessionTokenTtl;
        }

        public int getPbkdf2Iterations() {
            return pbkdf2Iterations;
        }

        public void setPbkdf2Iterations(int pbkdf2Iterations) {
            this.pbkdf2Iterations = pbkdf2Iterations;
        }

        public int getSaltLength() {
            return saltLength;
        }

        public void setSaltLength(int saltLength) {
            this.saltLength = saltLength;
        }
    }

    public static class Feed {
        private int postsPerPage = 25;
        private int defaultPageSize = 20;
        private int maxPageSize = 100;

        public int getPostsPerPage() {
            return postsPerPage;
        }

        public void setPostsPerPage(int postsPerPage) {
            this.postsPerPage = postsPerPage;
        }

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }
    }

    public static class Mail {
        private String from;
        private String resetUrlTemplate;

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        /**
         * Link placed in reset mails; {@code {token}} is replaced by the reset token.
         */
        public String getResetUrlTemplate() {
            return resetUrlTemplate;
        }

        public void setResetUrlTemplate(String resetUrlTemplate) {
            this.resetUrlTemplate = resetUrlTemplate;
        }
    }

    public static class Notification {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 100;

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
