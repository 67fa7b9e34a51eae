package com.patina.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans.
 */
@Configuration
public class OrchestratorConfig {

    // Injected wherever run time is measured, so tests can pin it.
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
