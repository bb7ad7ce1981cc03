package com.example.reminder.shared.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Scheduling is only switched on when the service triggers itself. The default deployment
 * relies on an external caller hitting the trigger endpoint.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "reminder.cron", name = "internal-trigger-enabled", havingValue = "true")
public class SchedulingConditionalConfig {
}
