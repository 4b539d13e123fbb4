package com.numbertrack.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private MockEnvironment environment;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/numbertrack")
                .withProperty("jwt.secret", EnvironmentValidator.PLACEHOLDER_SECRET)
                .withProperty("jwt.expiration", "900000")
                .withProperty("app.cors.allowed-origins", "http://localhost:3000")
                .withProperty("app.frontend-base-url", "http://localhost:3000")
                .withProperty("app.mail.from", "no-reply@example.com");
    }

    @Test
    void developmentDefaultsPass() {
        assertThat(new EnvironmentValidator(environment).collectProblems()).isEmpty();
    }

    @Test
    void placeholderSecretIsRejectedInProd() {
        environment.setActiveProfiles("prod");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactly("jwt.secret must be replaced with a random value in prod");
    }

    @Test
    void missingAndOutOfRangeValuesAreAllReported() {
        environment.setProperty("app.mail.from", " ");
        environment.setProperty("jwt.expiration", "1000");
        environment.setProperty("app.auth.revocation-store", "memcached");

        assertThat(new EnvironmentValidator(environment).collectProblems()).containsExactlyInAnyOrder(
                "missing property app.mail.from",
                "jwt.expiration must be between 300000 and 86400000 ms",
                "app.auth.revocation-store must be memory or redis");
        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Environment validation failed");
    }
}
