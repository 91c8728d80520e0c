package com.inboxpilot.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Shared engine beans. Time is always read through the {@link Clock} so interrupt
 * deadlines can be tested deterministically.
 */
@Configuration
@EnableScheduling
public class EngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
