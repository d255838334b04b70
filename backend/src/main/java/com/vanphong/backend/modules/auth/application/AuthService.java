package com.vanphong.backend.modules.auth.application;

import java.util.Set;

import com.vanphong.backend.global.security.PermissionCode;
import com.vanphong.backend.global.security.RequesterKind;
import com.vanphong.backend.modules.account.domain.User;
import com.vanphong.backend.modules.account.infrastructure.persistence.UserRepository;
import com.vanphong.backend.modules.app.domain.App;
import com.vanphong.backend.modules.app.infrastructure.persistence.AppRepository;
import com.vanphong.backend.modules.auth.presentation.dto.AccessTokenResponse;
import com.vanphong.backend.modules.auth.presentation.dto.AppTokenRequest;
import com.vanphong.backend.modules.auth.presentation.dto.AppTokenResponse;
import com.vanphong.backend.modules.auth.presentation.dto.LoginRequest;
import com.vanphong.backend.modules.auth.presentation.dto.LoginResponse;
import com.vanphong.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(readOnly = true)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final AppRepository appRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public AuthService(
            UserRepository userRepository,
            AppRepository appRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.userRepository = userRepository;
        this.appRepository = appRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    public LoginResponse login(LoginRequest request) {
        User user = userRepository.findByEmailIgnoreCase(request.email().trim())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS"));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            log.debug("Password mismatch for user {}", user.getId());
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS");
        }

        if (!user.isActive()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "USER_INACTIVE");
        }

        RequesterKind kind = user.isStaff() ? RequesterKind.STAFF : RequesterKind.CUSTOMER;
        Set<PermissionCode> permissions = user.effectivePermissions();
        AccessTokenResponse tokens = jwtTokenService.issueAccessToken(user.getId(), kind, permissions);
        log.info("Issued {} access token for user {}", kind, user.getId());

        UserProfileResponse profile = new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getDisplayName(),
                user.isStaff(),
                permissions.stream().map(PermissionCode::name).sorted().toList()
        );
        return new LoginResponse(tokens, profile);
    }

    public AppTokenResponse authenticateApp(AppTokenRequest request) {
        App app = appRepository.findByTokenHash(AppTokenHasher.hash(request.token().trim()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS"));

        if (!app.isActive()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "APP_INACTIVE");
        }

        Set<PermissionCode> permissions = app.getPermissions();
        AccessTokenResponse tokens = jwtTokenService.issueAccessToken(app.getId(), RequesterKind.APP, permissions);
        log.info("Issued app access token for app {}", app.getId());

        return new AppTokenResponse(
                tokens,
                app.getId(),
                app.getName(),
                permissions.stream().map(PermissionCode::name).sorted().toList()
        );
    }
}
