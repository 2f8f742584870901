package com.accessibility.checker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableScheduling
public class AsyncConfig {
    // Scheduling drives the periodic cache sweep; the analysis worker pool is owned by AnalysisOrchestrator

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
