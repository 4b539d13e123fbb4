package com.numbertrack.backend.global.common.time;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

class TimeConfigTest {

    private final TimeConfig config = new TimeConfig();

    @Test
    void auditingStampsFollowTheSharedClock() {
        OffsetDateTime fixed = OffsetDateTime.parse("2025-04-01T12:30:00Z");
        Clock clock = Clock.fixed(fixed.toInstant(), ZoneOffset.UTC);

        assertThat(config.clockDateTimeProvider(clock).getNow()).contains(fixed);
    }

    @Test
    void systemClockRunsInUtc() {
        assertThat(config.utcClock().getZone()).isEqualTo(ZoneOffset.UTC);
    }
}
