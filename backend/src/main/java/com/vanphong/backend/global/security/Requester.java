package com.vanphong.backend.global.security;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Identity a metadata request is evaluated for. {@code id} is the user id for customers and
 * staff, the app id for apps, and {@code null} for the anonymous requester.
 */
public record Requester(RequesterKind kind, UUID id, Set<PermissionCode> permissions) {

    private static final Requester ANONYMOUS = new Requester(RequesterKind.ANONYMOUS, null, Set.of());

    public Requester {
        Objects.requireNonNull(kind, "kind is required");
        if (kind != RequesterKind.ANONYMOUS) {
            Objects.requireNonNull(id, "id is required for authenticated requesters");
        }
        permissions = permissions == null || permissions.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(permissions));
    }

    public static Requester anonymous() {
        return ANONYMOUS;
    }

    public static Requester customer(UUID userId) {
        return new Requester(RequesterKind.CUSTOMER, userId, Set.of());
    }

    public static Requester staff(UUID userId, Collection<PermissionCode> permissions) {
        return new Requester(RequesterKind.STAFF, userId, toSet(permissions));
    }

    public static Requester app(UUID appId, Collection<PermissionCode> permissions) {
        return new Requester(RequesterKind.APP, appId, toSet(permissions));
    }

    public boolean isAnonymous() {
        return kind == RequesterKind.ANONYMOUS;
    }

    public boolean isUser() {
        return kind.isUser();
    }

    public boolean isApp() {
        return kind == RequesterKind.APP;
    }

    public boolean hasPermission(PermissionCode permission) {
        return permission != null && permissions.contains(permission);
    }

    public boolean isUser(UUID userId) {
        return isUser() && userId != null && userId.equals(id);
    }

    public boolean isApp(UUID appId) {
        return isApp() && appId != null && appId.equals(id);
    }

    private static Set<PermissionCode> toSet(Collection<PermissionCode> permissions) {
        return permissions == null || permissions.isEmpty() ? Set.of() : EnumSet.copyOf(permissions);
    }
}
