package com.presentos.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Provides the wall clock used to stamp inbound messages and resolve relative dates.
 * Owns {@code presentos.timezone}; nothing else reads it.
 */
@Configuration
public class ClockConfig {

    private static final Logger log = LoggerFactory.getLogger(ClockConfig.class);

    @Bean
    Clock routerClock(@Value("${presentos.timezone:Asia/Kolkata}") String timezone) {
        ZoneId zone = ZoneId.of(timezone);
        log.info("Router clock running in zone {}", zone);
        return Clock.system(zone);
    }
}
