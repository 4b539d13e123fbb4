package com.numbertrack.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.numbertrack.backend.global.error.ProblemException;
import com.numbertrack.backend.global.security.JwtAuthenticationPrincipal;
import com.numbertrack.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.numbertrack.backend.modules.auth.domain.AdminUser;
import com.numbertrack.backend.modules.auth.infrastructure.persistence.AdminUserRepository;
import com.numbertrack.backend.modules.auth.presentation.dto.LoginRequest;
import com.numbertrack.backend.modules.auth.presentation.dto.LoginResponse;
import com.numbertrack.backend.modules.auth.presentation.dto.LoginResponse.AdminProfile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final AdminUserRepository adminUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final TokenRevocationStore tokenRevocationStore;
    private final Clock clock;

    public AuthService(
            AdminUserRepository adminUserRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            TokenRevocationStore tokenRevocationStore,
            Clock clock
    ) {
        this.adminUserRepository = adminUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.tokenRevocationStore = tokenRevocationStore;
        this.clock = clock;
    }

    public LoginResponse login(LoginRequest request) {
        AdminUser user = adminUserRepository.findByUsernameIgnoreCase(request.username().trim())
                .orElseThrow(() -> invalidCredentials());

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            log.info("login rejected for {}", user.getUsername());
            throw invalidCredentials();
        }
        if (!user.isActive()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "USER_INACTIVE", "admin account is disabled");
        }

        List<String> roles = List.of(user.getRole());
        IssuedToken token = jwtTokenService.issueAccessToken(user.getId(), user.getUsername(), roles);
        user.setLastLoginAt(OffsetDateTime.now(clock));

        return new LoginResponse(
                token.accessToken(),
                LoginResponse.DEFAULT_TOKEN_TYPE,
                jwtTokenService.getAccessTokenTtlMillis() / 1000L,
                token.issuedAt(),
                toProfile(user)
        );
    }

    public void logout(JwtAuthenticationPrincipal principal) {
        tokenRevocationStore.revoke(principal.tokenId(), principal.expiresAt());
        log.info("token {} revoked for {}", principal.tokenId(), principal.username());
    }

    @Transactional(readOnly = true)
    public AdminProfile profile(UUID userId) {
        return toProfile(loadAdmin(userId));
    }

    @Transactional(readOnly = true)
    public AdminUser loadAdmin(UUID userId) {
        return adminUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "USER_NOT_FOUND", "admin account no longer exists"));
    }

    private static AdminProfile toProfile(AdminUser user) {
        return new AdminProfile(user.getId(), user.getUsername(), List.of(user.getRole()), user.getEmployeeBusinessId());
    }

    private static ProblemException invalidCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "username or password is incorrect");
    }
}
