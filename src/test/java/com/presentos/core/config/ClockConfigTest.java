package com.presentos.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Clock;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class ClockConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(ClockConfig.class);

    @Test
    @DisplayName("Clock runs in the zone named by presentos.timezone")
    void usesConfiguredZone() {
        runner.withPropertyValues("presentos.timezone=America/New_York")
                .run(context -> assertEquals(ZoneId.of("America/New_York"), context.getBean(Clock.class).getZone()));
    }

    @Test
    @DisplayName("Clock defaults to Asia/Kolkata when no zone is configured")
    void defaultsToKolkata() {
        runner.run(context -> assertEquals(ZoneId.of("Asia/Kolkata"), context.getBean(Clock.class).getZone()));
    }
}
