package com.linkdrop.api.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // Every expiry comparison runs against UTC wall time
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
