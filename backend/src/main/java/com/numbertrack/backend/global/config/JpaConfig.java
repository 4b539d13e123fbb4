package com.numbertrack.backend.global.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Auditing stamps created_at/updated_at through the clock-backed provider in
 * {@link com.numbertrack.backend.global.common.time.TimeConfig}.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.numbertrack.backend.modules")
@EnableJpaAuditing(dateTimeProviderRef = "clockDateTimeProvider")
public class JpaConfig {
}
