package com.carbondna.api.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Single time source for record timestamps and anchoring periods (UTC).
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }
}
