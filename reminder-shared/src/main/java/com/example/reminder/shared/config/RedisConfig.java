package com.example.reminder.shared.config;

import com.example.reminder.shared.model.ScheduleCacheSnapshot;
import com.example.reminder.shared.model.SentMarker;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

@Configuration
@ConditionalOnProperty(prefix = "reminder.store", name = "type", havingValue = "redis")
public class RedisConfig {

    @Bean
    public RedisTemplate<String, SentMarker> sentMarkerRedisTemplate(RedisConnectionFactory connectionFactory, ObjectMapper objectMapper) {
        RedisTemplate<String, SentMarker> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        Jackson2JsonRedisSerializer<SentMarker> serializer = new Jackson2JsonRedisSerializer<>(objectMapper, SentMarker.class);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(serializer);
        return template;
    }

    @Bean
    public RedisTemplate<String, ScheduleCacheSnapshot> scheduleSnapshotRedisTemplate(RedisConnectionFactory connectionFactory, ObjectMapper objectMapper) {
        RedisTemplate<String, ScheduleCacheSnapshot> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        Jackson2JsonRedisSerializer<ScheduleCacheSnapshot> serializer = new Jackson2JsonRedisSerializer<>(objectMapper, ScheduleCacheSnapshot.class);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(serializer);
        return template;
    }
}
