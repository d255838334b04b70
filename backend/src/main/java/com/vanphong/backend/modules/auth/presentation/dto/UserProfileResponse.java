package com.vanphong.backend.modules.auth.presentation.dto;

import java.util.List;
import java.util.UUID;

public record UserProfileResponse(
        UUID userId,
        String email,
        String displayName,
        boolean staff,
        List<String> permissions
) {
}
