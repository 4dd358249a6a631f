package com.support.triage.spring_server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TriageConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
