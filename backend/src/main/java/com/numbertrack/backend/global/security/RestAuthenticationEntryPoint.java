package com.numbertrack.backend.global.security;

import java.io.IOException;
import java.util.regex.Pattern;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * 401 for admin endpoints. Token failures raised by {@link JwtAuthenticationFilter} carry their code
 * (e.g. {@code ACCESS_TOKEN_REVOKED}) as the exception message.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private static final Pattern PROBLEM_CODE = Pattern.compile("[A-Z][A-Z_]+");

    private final ProblemResponseWriter writer;

    RestAuthenticationEntryPoint(ProblemResponseWriter writer) {
        this.writer = writer;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        String message = authException.getMessage();
        String code = message != null && PROBLEM_CODE.matcher(message).matches() ? message : "UNAUTHORIZED";
        writer.write(request, response, HttpStatus.UNAUTHORIZED, code, "admin authentication required");
    }
}
