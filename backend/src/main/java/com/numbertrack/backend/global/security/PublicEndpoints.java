package com.numbertrack.backend.global.security;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Paths reachable without an admin bearer token. Employees open verification links from mail.
 */
final class PublicEndpoints {

    static final String LOGIN = "/auth/login";

    static final String[] VERIFICATION = {"/verification/info", "/verification/submit"};

    static final String[] API_DOCS = {"/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html"};

    static final String[] HEALTH = {"/actuator/health", "/actuator/health/**"};

    private PublicEndpoints() {
    }

    /**
     * Bearer parsing is skipped here so a stale admin token in the browser cannot break a verification link.
     */
    static boolean bypassesTokenParsing(HttpServletRequest request) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = request.getRequestURI().substring(request.getContextPath().length());
        if (path.equals(LOGIN) || path.startsWith("/actuator/health")) {
            return true;
        }
        for (String verificationPath : VERIFICATION) {
            if (path.startsWith(verificationPath)) {
                return true;
            }
        }
        return false;
    }
}
