package com.vanphong.backend.modules.auth.presentation.dto;

public record LoginResponse(
        AccessTokenResponse tokens,
        UserProfileResponse user
) {
}
