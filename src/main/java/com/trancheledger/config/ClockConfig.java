package com.trancheledger.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the clock that stamps reports and dates held-day counts. Tests pass a fixed clock
 * instead.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(LedgerProperties properties) {
        String zoneId = properties.getZoneId();
        if (zoneId == null || zoneId.isBlank()) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(zoneId));
    }
}
