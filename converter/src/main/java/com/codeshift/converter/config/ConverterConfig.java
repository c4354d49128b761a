package com.codeshift.converter.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ConverterConfig {

    // Governance timestamps are always UTC.
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
