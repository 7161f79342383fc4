package com.multila.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared time sources. Services read "now" from the UTC clock only; the display zone is used when
 * timestamps leave the system (CSV exports).
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public ZoneId displayZone(@Value("${multila.time-zone:Europe/Berlin}") String zoneId) {
        return ZoneId.of(zoneId);
    }
}
