package com.example.reminder.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Metrics for reminder dispatch. Meters are registered up front so dashboards see zeros
 * before the first tick.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    public static final String CRON_RUNS = "reminder.cron.runs";
    public static final String NOTIFICATIONS = "reminder.notifications";
    public static final String MARKERS_CLEANED = "reminder.markers.cleaned";

    @Bean
    public MeterBinder reminderMetrics() {
        return registry -> {
            registry.counter(CRON_RUNS, "outcome", "processed");
            registry.counter(CRON_RUNS, "outcome", "needs_sync");

            registry.counter(NOTIFICATIONS, "status", "sent");
            registry.counter(NOTIFICATIONS, "status", "skipped");
            registry.counter(NOTIFICATIONS, "status", "error");

            registry.counter(MARKERS_CLEANED);

            Timer.builder("reminder.cron.duration")
                    .description("Time taken by one reminder tick")
                    .register(registry);
        };
    }

    @Bean
    public ReminderMetricsCollector reminderMetricsCollector(MeterRegistry registry) {
        return new ReminderMetricsCollector(registry);
    }

    /**
     * Caches meters by name and tags so hot paths skip the registry lookup.
     */
    public static class ReminderMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();

        public ReminderMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            incrementCounter(name, 1, tags);
        }

        public void incrementCounter(String name, double amount, String... tags) {
            if (amount <= 0) {
                return;
            }
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment(amount);
        }

        public void recordTimer(String name, long durationMs, String... tags) {
            String key = name + "_" + String.join("_", tags);
            timers.computeIfAbsent(key, k -> Timer.builder(name).tags(tags).register(registry))
                    .record(durationMs, TimeUnit.MILLISECONDS);
        }
    }
}
