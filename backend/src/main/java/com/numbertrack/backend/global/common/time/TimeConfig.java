package com.numbertrack.backend.global.common.time;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;

/**
 * Every notion of "now" in the service: token expiry, default assignment and reclaim dates,
 * submission timestamps and the created_at/updated_at auditing stamps all derive from one UTC clock.
 * Tests replace it with {@link Clock#fixed}.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    /**
     * Referenced by name from {@code @EnableJpaAuditing}.
     */
    @Bean
    public DateTimeProvider clockDateTimeProvider(Clock clock) {
        return () -> Optional.of(OffsetDateTime.now(clock));
    }
}
