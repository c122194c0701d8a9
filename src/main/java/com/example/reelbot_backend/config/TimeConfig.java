package com.example.reelbot_backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Single time source for queue timestamps, eviction windows and composite bookkeeping.
 */
@Configuration
class TimeConfig {
    @Bean
    public Clock utcClock() {
        return Clock.systemUTC();
    }
}
