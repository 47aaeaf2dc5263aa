package com.tony.esportsAnalytics.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AppConfig {

    // Toutes les dates techniques (last_fetched_at, fetched_at...) sont en UTC
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
