package com.numbertrack.backend.modules.auth.presentation;

import com.numbertrack.backend.global.security.SecurityUtils;
import com.numbertrack.backend.modules.auth.application.AuthService;
import com.numbertrack.backend.modules.auth.presentation.dto.LoginRequest;
import com.numbertrack.backend.modules.auth.presentation.dto.LoginResponse;
import com.numbertrack.backend.modules.auth.presentation.dto.LoginResponse.AdminProfile;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
@Tag(name = "Admin session")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/login")
    @Operation(summary = "Exchange admin credentials for a bearer token")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @GetMapping("/me")
    @Operation(summary = "Admin bound to the bearer token, with the linked employee id used as operator")
    public AdminProfile me() {
        return authService.profile(SecurityUtils.getCurrentUserId());
    }

    @PostMapping("/logout")
    @Operation(summary = "Revoke the bearer token until it would have expired")
    public ResponseEntity<Void> logout() {
        authService.logout(SecurityUtils.getCurrentPrincipal());
        return ResponseEntity.noContent().build();
    }
}
