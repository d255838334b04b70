package com.vanphong.backend.global.config;

import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.global.security.JwtAuthenticationPrincipal;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Resolves the current auditor (user or app id) for JPA auditing.
 * Anonymous requests have no auditor.
 */
public class VanphongAuditorAware implements AuditorAware<UUID> {

    @Override
    @NonNull
    public Optional<UUID> getCurrentAuditor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }
        if (authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal) {
            return Optional.ofNullable(principal.subjectId());
        }
        return Optional.empty();
    }
}
