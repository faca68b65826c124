package com.stagecraft.stagecraft_backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // Generation timestamp in script headers
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
