package com.numbertrack.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;
import java.util.UUID;

import com.numbertrack.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.numbertrack.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.numbertrack.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.numbertrack.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-secret-with-enough-bytes-0123456789";
    private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");
    private static final long TTL_MILLIS = Duration.ofMinutes(15).toMillis();

    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET);

    @Test
    void issuedTokenCarriesAdminIdentityAndJti() {
        UUID adminId = UUID.randomUUID();
        IssuedToken issued = serviceAt(NOW).issueAccessToken(adminId, "ops-admin", List.of("ADMIN"));

        ParsedToken parsed = serviceAt(NOW.plusSeconds(60)).parseAccessToken(issued.accessToken());

        assertThat(parsed.userId()).isEqualTo(adminId);
        assertThat(parsed.username()).isEqualTo("ops-admin");
        assertThat(parsed.roles()).containsExactly("ADMIN");
        assertThat(parsed.tokenId()).isEqualTo(issued.tokenId());
        assertThat(parsed.expiresAt().toInstant()).isEqualTo(NOW.plusMillis(TTL_MILLIS));
    }

    @Test
    void expiredTokenIsRejected() {
        String token = serviceAt(NOW).issueAccessToken(UUID.randomUUID(), "ops-admin", List.of("ADMIN")).accessToken();

        assertThatThrownBy(() -> serviceAt(NOW.plusMillis(TTL_MILLIS).plusSeconds(120)).parseAccessToken(token))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void tokenFromAnotherIssuerIsRejectedEvenWithTheSameKey() {
        String foreign = Jwts.builder()
                .issuer("someone-else")
                .id(UUID.randomUUID().toString())
                .subject(UUID.randomUUID().toString())
                .expiration(Date.from(NOW.plusSeconds(600)))
                .signWith(provider.getSecretKey(), Jwts.SIG.HS256)
                .compact();

        assertThatThrownBy(() -> serviceAt(NOW).parseAccessToken(foreign))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void tokenWithoutJtiCannotBeRevokedSoItIsRejected() {
        String noJti = Jwts.builder()
                .issuer(JwtTokenService.ISSUER)
                .subject(UUID.randomUUID().toString())
                .expiration(Date.from(NOW.plusSeconds(600)))
                .signWith(provider.getSecretKey(), Jwts.SIG.HS256)
                .compact();

        assertThatThrownBy(() -> serviceAt(NOW).parseAccessToken(noJti))
                .isInstanceOf(InvalidTokenException.class)
                .hasMessageContaining("jti");
    }

    @Test
    void shortSecretsFailFast() {
        assertThatThrownBy(() -> new JwtTokenProvider("too-short"))
                .isInstanceOf(IllegalStateException.class);
    }

    private JwtTokenService serviceAt(Instant instant) {
        return new JwtTokenService(provider, TTL_MILLIS, Clock.fixed(instant, ZoneOffset.UTC));
    }
}
