package com.maintenance.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
