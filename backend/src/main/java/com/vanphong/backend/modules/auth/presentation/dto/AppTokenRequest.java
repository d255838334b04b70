package com.vanphong.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record AppTokenRequest(
        @NotBlank(message = "token is required") String token
) {
}
