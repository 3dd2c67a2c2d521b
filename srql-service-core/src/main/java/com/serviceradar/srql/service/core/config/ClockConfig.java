package com.serviceradar.srql.service.core.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Time windows such as {@code last_1h} resolve against this clock. */
@Configuration
public class ClockConfig {

    @Bean
    public Clock srqlClock() {
        return Clock.systemUTC();
    }
}
