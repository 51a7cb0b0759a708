package com.authcore.backend.global.config;

import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Shared infrastructure beans: a single UTC clock for every module and the scheduler
 * that drives background sweeps.
 */
@Configuration
@EnableScheduling
public class CoreConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }
}
