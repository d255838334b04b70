package com.vanphong.backend.global.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Resolves the requester of the current request, falling back to the anonymous requester
     * when no bearer token was presented.
     */
    public static Requester currentRequester() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal) {
            return principal.toRequester();
        }
        return Requester.anonymous();
    }
}
