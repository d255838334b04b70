package com.vanphong.backend.global.security;

import java.util.Set;
import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID subjectId, RequesterKind kind, Set<PermissionCode> permissions) {

    public Requester toRequester() {
        return new Requester(kind, subjectId, permissions);
    }
}
