package com.numbertrack.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import com.numbertrack.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Access to the admin operator bound to the current request.
 * Public verification endpoints and batch worker threads have no operator.
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<JwtAuthenticationPrincipal> findOperator() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }
        if (authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        return findOperator().orElseThrow(() -> new ProblemException(
                HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "admin session required"));
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }
}
