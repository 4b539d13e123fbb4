package com.numbertrack.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.List;
import java.util.UUID;

import com.numbertrack.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies admin access tokens. Every token carries a {@code jti} so logout can revoke it.
 */
@Service
public class JwtTokenService {

    static final String ISSUER = "numbertrack";
    private static final String CLAIM_USERNAME = "usr";
    private static final String CLAIM_ROLES = "roles";

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

    public IssuedToken issueAccessToken(UUID adminId, String username, List<String> roles) {
        Instant issuedAt = clock.instant();
        Instant expiresAt = issuedAt.plusMillis(accessTokenTtlMillis);
        String tokenId = UUID.randomUUID().toString();

        String compact = Jwts.builder()
                .issuer(ISSUER)
                .id(tokenId)
                .subject(adminId.toString())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .claim(CLAIM_USERNAME, username)
                .claim(CLAIM_ROLES, roles)
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
        return new IssuedToken(compact, tokenId, atZone(issuedAt), atZone(expiresAt));
    }

    public ParsedToken parseAccessToken(String token) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .requireIssuer(ISSUER)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException ex) {
            throw new InvalidTokenException("access token rejected: " + ex.getMessage(), ex);
        }
        if (claims.getId() == null || claims.getSubject() == null || claims.getExpiration() == null) {
            throw new InvalidTokenException("access token lacks jti, sub or exp", null);
        }

        List<?> rawRoles = claims.get(CLAIM_ROLES, List.class);
        List<String> roles = rawRoles == null ? List.of() : rawRoles.stream().map(String::valueOf).toList();
        UUID adminId;
        try {
            adminId = UUID.fromString(claims.getSubject());
        } catch (IllegalArgumentException ex) {
            throw new InvalidTokenException("access token subject is not an admin id", ex);
        }
        return new ParsedToken(adminId, claims.get(CLAIM_USERNAME, String.class), roles, claims.getId(),
                atZone(claims.getExpiration().toInstant()));
    }

    public long getAccessTokenTtlMillis() {
        return accessTokenTtlMillis;
    }

    private OffsetDateTime atZone(Instant instant) {
        return OffsetDateTime.ofInstant(instant, clock.getZone());
    }

    public record IssuedToken(String accessToken, String tokenId, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public record ParsedToken(UUID userId, String username, List<String> roles, String tokenId, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
