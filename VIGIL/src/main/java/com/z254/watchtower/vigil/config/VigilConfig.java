package com.z254.watchtower.vigil.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core infrastructure beans.
 */
@Configuration
public class VigilConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
