package com.example.reminder.shared.config;

import com.example.reminder.shared.model.SentMarker;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Local marker map. Unbounded and without expiry: markers leave only through the cleanup pass
 * or an explicit clear, the same as in the Redis store. Cleanup keeps the map at roughly one
 * hour of sends.
 */
@Configuration
@ConditionalOnProperty(prefix = "reminder.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class CaffeineConfig {

    @Bean
    public Cache<String, SentMarker> sentMarkerCache() {
        return Caffeine.newBuilder()
                .recordStats()
                .build();
    }
}
