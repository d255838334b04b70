package com.vanphong.backend.global.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Fixed set of permissions a staff user or an app can be granted.
 */
public enum PermissionCode {
    MANAGE_USERS,
    MANAGE_STAFF,
    MANAGE_ORDERS,
    MANAGE_CHECKOUTS,
    MANAGE_ROOMS,
    MANAGE_ROOM_TYPES_AND_ATTRIBUTES,
    MANAGE_PAGE_TYPES_AND_ATTRIBUTES,
    MANAGE_APPS;

    /** Lenient lookup used when reading permission claims back from a token. */
    public static Optional<PermissionCode> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(code.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
