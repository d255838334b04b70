package com.vanphong.backend.modules.auth.presentation.dto;

import java.util.List;
import java.util.UUID;

public record AppTokenResponse(
        AccessTokenResponse tokens,
        UUID appId,
        String name,
        List<String> permissions
) {
}
