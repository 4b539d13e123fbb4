package com.numbertrack.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;

import io.jsonwebtoken.security.Keys;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HS256 key for admin tokens. {@code jwt.secret} is read as UTF-8 text unless it starts with {@code base64:}.
 */
@Component
public class JwtTokenProvider {

    static final String BASE64_PREFIX = "base64:";
    private static final int MIN_KEY_BYTES = 32;

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secret) {
        this.secretKey = Keys.hmacShaKeyFor(keyMaterial(secret));
    }

    static byte[] keyMaterial(String secret) {
        byte[] material = secret.startsWith(BASE64_PREFIX)
                ? Base64.getDecoder().decode(secret.substring(BASE64_PREFIX.length()))
                : secret.getBytes(StandardCharsets.UTF_8);
        if (material.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("jwt.secret must carry at least " + MIN_KEY_BYTES + " bytes of key material");
        }
        return material;
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}
