package com.numbertrack.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or left at unsafe defaults.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String PLACEHOLDER_SECRET = "change-me-numbertrack-dev-secret-0000000000";

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins",
            "app.frontend-base-url",
            "app.mail.from"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("[CONFIG] {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }
        log.info("[CONFIG] environment validated");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();
        for (String key : REQUIRED_PROPERTIES) {
            String value = environment.getProperty(key);
            if (value == null || value.isBlank()) {
                problems.add("missing property " + key);
            }
        }

        boolean production = environment.acceptsProfiles(Profiles.of("prod"));
        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(secret -> production && secret.equals(PLACEHOLDER_SECRET))
                .ifPresent(secret -> problems.add("jwt.secret must be replaced with a random value in prod"));

        String expiration = environment.getProperty("jwt.expiration");
        if (expiration != null && !expiration.isBlank()) {
            try {
                long millis = Long.parseLong(expiration.trim());
                if (millis < 300_000 || millis > 86_400_000) {
                    problems.add("jwt.expiration must be between 300000 and 86400000 ms");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration must be numeric");
            }
        }

        String store = environment.getProperty("app.auth.revocation-store", "memory");
        if (!store.equals("memory") && !store.equals("redis")) {
            problems.add("app.auth.revocation-store must be memory or redis");
        }
        return problems;
    }
}
