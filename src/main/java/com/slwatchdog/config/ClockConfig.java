package com.slwatchdog.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    /** Single time source so tests can pin "now". */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
