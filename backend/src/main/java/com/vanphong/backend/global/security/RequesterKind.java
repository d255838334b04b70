package com.vanphong.backend.global.security;

public enum RequesterKind {
    ANONYMOUS,
    CUSTOMER,
    STAFF,
    APP;

    public boolean isUser() {
        return this == CUSTOMER || this == STAFF;
    }
}
