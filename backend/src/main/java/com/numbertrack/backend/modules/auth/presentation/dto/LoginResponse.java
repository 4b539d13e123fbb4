package com.numbertrack.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record LoginResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        OffsetDateTime issuedAt,
        AdminProfile user
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public record AdminProfile(UUID id, String username, List<String> roles, String employeeId) {
    }
}
