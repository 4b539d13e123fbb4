package com.numbertrack.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.numbertrack.backend.modules.auth.application.JwtTokenService;
import com.numbertrack.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.numbertrack.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.numbertrack.backend.modules.auth.application.TokenRevocationStore;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds an admin operator from {@code Authorization: Bearer <jwt>}. Requests without the header pass through
 * unauthenticated and are rejected later by the authorization rules.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenService jwtTokenService;
    private final TokenRevocationStore tokenRevocationStore;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public JwtAuthenticationFilter(
            JwtTokenService jwtTokenService,
            TokenRevocationStore tokenRevocationStore,
            RestAuthenticationEntryPoint authenticationEntryPoint
    ) {
        this.jwtTokenService = jwtTokenService;
        this.tokenRevocationStore = tokenRevocationStore;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        ParsedToken parsed;
        try {
            parsed = jwtTokenService.parseAccessToken(token);
        } catch (InvalidTokenException ex) {
            reject(request, response, new BadCredentialsException("INVALID_ACCESS_TOKEN", ex));
            return;
        }
        if (tokenRevocationStore.isRevoked(parsed.tokenId())) {
            reject(request, response, new BadCredentialsException("ACCESS_TOKEN_REVOKED"));
            return;
        }

        SecurityContextHolder.getContext().setAuthentication(toAuthentication(parsed, token, request));
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return PublicEndpoints.bypassesTokenParsing(request);
    }

    private UsernamePasswordAuthenticationToken toAuthentication(ParsedToken parsed, String token, HttpServletRequest request) {
        List<SimpleGrantedAuthority> authorities = parsed.roles().stream()
                .map(role -> new SimpleGrantedAuthority("ROLE_" + role))
                .toList();
        JwtAuthenticationPrincipal operator = new JwtAuthenticationPrincipal(
                parsed.userId(), parsed.username(), parsed.roles(), parsed.tokenId(), parsed.expiresAt());
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(operator, token, authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        return authentication;
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, BadCredentialsException cause)
            throws IOException {
        SecurityContextHolder.clearContext();
        authenticationEntryPoint.commence(request, response, cause);
    }
}
