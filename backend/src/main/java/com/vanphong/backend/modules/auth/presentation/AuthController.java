package com.vanphong.backend.modules.auth.presentation;

import com.vanphong.backend.modules.auth.application.AuthService;
import com.vanphong.backend.modules.auth.presentation.dto.AppTokenRequest;
import com.vanphong.backend.modules.auth.presentation.dto.AppTokenResponse;
import com.vanphong.backend.modules.auth.presentation.dto.LoginRequest;
import com.vanphong.backend.modules.auth.presentation.dto.LoginResponse;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Log in a customer or staff user with email and password")
    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @Operation(summary = "Exchange a raw app token for a short-lived access token")
    @PostMapping("/auth/apps/token")
    public ResponseEntity<AppTokenResponse> appToken(@Valid @RequestBody AppTokenRequest request) {
        return ResponseEntity.ok(authService.authenticateApp(request));
    }
}
