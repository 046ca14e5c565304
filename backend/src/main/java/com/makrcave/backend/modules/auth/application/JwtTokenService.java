package com.makrcave.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.makrcave.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.springframework.stereotype.Service;

/**
 * Reads the access tokens issued by the MakrCave identity service. This backend never issues tokens.
 */
@Service
public class JwtTokenService {

    public static final String ROLE_CLAIM = "role";
    public static final String MAKERSPACE_CLAIM = "makerspaceId";
    public static final String PERMISSIONS_CLAIM = "permissions";

    private final JwtTokenProvider tokenProvider;
    private final Clock clock;

    public JwtTokenService(JwtTokenProvider tokenProvider, Clock clock) {
        this.tokenProvider = tokenProvider;
        this.clock = clock;
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID userId = UUID.fromString(claims.getSubject());
            String role = claims.get(ROLE_CLAIM, String.class);
            String makerspaceClaim = claims.get(MAKERSPACE_CLAIM, String.class);
            UUID makerspaceId = makerspaceClaim == null || makerspaceClaim.isBlank() ? null : UUID.fromString(makerspaceClaim);
            List<?> permissionsClaim = claims.get(PERMISSIONS_CLAIM, List.class);
            Set<String> permissions = permissionsClaim == null ? Set.of() : permissionsClaim.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new ParsedToken(
                    userId,
                    role,
                    makerspaceId,
                    permissions,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record ParsedToken(
            UUID userId,
            String role,
            UUID makerspaceId,
            Set<String> permissions,
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
