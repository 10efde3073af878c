package com.meetlink.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Single UTC clock for every expiry, auto-end and audit timestamp.
 * Scheduling is enabled here because the maintenance sweeps are the only other
 * time-driven consumers; they read the same clock.
 */
@Configuration
@EnableScheduling
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }
}
