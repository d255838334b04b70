package com.vanphong.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.vanphong.backend.global.security.PermissionCode;
import com.vanphong.backend.global.security.RequesterKind;
import com.vanphong.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.vanphong.backend.modules.auth.presentation.dto.AccessTokenResponse;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import javax.crypto.SecretKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    static final String CLAIM_KIND = "kind";
    static final String CLAIM_PERMISSIONS = "permissions";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    public AccessTokenResponse issueAccessToken(UUID subjectId, RequesterKind kind, Collection<PermissionCode> permissions) {
        if (kind == null || kind == RequesterKind.ANONYMOUS) {
            throw new IllegalArgumentException("access tokens are issued to users and apps only");
        }
        Instant now = clock.instant();
        OffsetDateTime issuedAt = OffsetDateTime.ofInstant(now, clock.getZone());
        Instant accessExpiry = now.plusMillis(accessTokenTtlMillis);

        SecretKey key = tokenProvider.getSecretKey();

        List<String> permissionCodes = permissions == null ? List.of() : permissions.stream()
                .map(PermissionCode::name)
                .sorted()
                .toList();

        String accessToken = Jwts.builder()
                .subject(subjectId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(accessExpiry))
                .claim(CLAIM_KIND, kind.name())
                .claim(CLAIM_PERMISSIONS, permissionCodes)
                .signWith(key, SIG.HS256)
                .compact();

        return new AccessTokenResponse(
                accessToken,
                AccessTokenResponse.DEFAULT_TOKEN_TYPE,
                accessTokenTtlMillis / 1000L,
                issuedAt
        );
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String subject = claims.getSubject();
            String kindClaim = claims.get(CLAIM_KIND, String.class);
            if (subject == null || kindClaim == null) {
                throw new InvalidTokenException("Access token is missing the subject or kind claim", null);
            }
            UUID subjectId = UUID.fromString(subject);
            RequesterKind kind = RequesterKind.valueOf(kindClaim);
            if (kind == RequesterKind.ANONYMOUS) {
                throw new InvalidTokenException("Anonymous tokens are not accepted", null);
            }
            List<?> permissionClaim = claims.get(CLAIM_PERMISSIONS, List.class);
            Set<PermissionCode> permissions = EnumSet.noneOf(PermissionCode.class);
            if (permissionClaim != null) {
                permissionClaim.stream()
                        .filter(Objects::nonNull)
                        .map(Object::toString)
                        .map(PermissionCode::fromCode)
                        .flatMap(Optional::stream)
                        .forEach(permissions::add);
            }
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new ParsedToken(
                    subjectId,
                    kind,
                    permissions,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public long getAccessTokenTtlMillis() {
        return accessTokenTtlMillis;
    }

    public record ParsedToken(
            UUID subjectId,
            RequesterKind kind,
            Set<PermissionCode> permissions,
            OffsetDateTime issuedAt,
            OffsetDateTime expiresAt
    ) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
