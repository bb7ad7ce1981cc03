package com.example.reminder.shared.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PropertiesConfig {

    @Bean
    @ConfigurationProperties(prefix = "reminder")
    public AppProperties appProperties() {
        // @ConfigurationProperties binds reminder.window.*, reminder.cron.*, reminder.marker.* etc.
        return new AppProperties();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
