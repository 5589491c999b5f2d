package com.flagship.collective_finance.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * UTC clock for expiry dates, monthly limits and subscription schedules.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
