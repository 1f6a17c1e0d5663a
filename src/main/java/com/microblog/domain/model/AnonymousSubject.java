package com.microblog.domain.model;

public enum AnonymousSubject implements SessionSubject {
    INSTANCE;

    @Override
    public boolean isAuthenticated() {
        return false;
    }

    @Override
    public String sessionKey() {
        return null;
    }
}
