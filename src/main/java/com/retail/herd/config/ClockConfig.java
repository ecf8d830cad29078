package com.retail.herd.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // Wall clock used to reject events stamped too far in the future
    @Bean
    public Clock systemUtcClock() {
        return Clock.systemUTC();
    }
}
