package com.numbertrack.backend.global.security;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record JwtAuthenticationPrincipal(
        UUID userId,
        String username,
        List<String> roles,
        String tokenId,
        OffsetDateTime expiresAt
) {
}
