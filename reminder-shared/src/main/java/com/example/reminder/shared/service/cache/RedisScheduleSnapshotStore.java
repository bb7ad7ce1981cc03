package com.example.reminder.shared.service.cache;

import com.example.reminder.shared.exception.StoreException;
import com.example.reminder.shared.model.ScheduleCacheSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.example.reminder.shared.util.Constants.RedisKeys.SCHEDULE_CACHE;

@Component
@Slf4j
@ConditionalOnProperty(prefix = "reminder.store", name = "type", havingValue = "redis")
public class RedisScheduleSnapshotStore implements ScheduleSnapshotStore {

    private final RedisTemplate<String, ScheduleCacheSnapshot> scheduleSnapshotRedisTemplate;

    public RedisScheduleSnapshotStore(@Qualifier("scheduleSnapshotRedisTemplate") RedisTemplate<String, ScheduleCacheSnapshot> scheduleSnapshotRedisTemplate) {
        this.scheduleSnapshotRedisTemplate = scheduleSnapshotRedisTemplate;
    }

    @Override
    public Optional<ScheduleCacheSnapshot> load() {
        try {
            return Optional.ofNullable(scheduleSnapshotRedisTemplate.opsForValue().get(SCHEDULE_CACHE));
        } catch (DataAccessException | SerializationException e) {
            throw new StoreException("Failed to read schedule snapshot from Redis", e);
        }
    }

    @Override
    public void replace(ScheduleCacheSnapshot snapshot) {
        try {
            scheduleSnapshotRedisTemplate.opsForValue().set(SCHEDULE_CACHE, snapshot);
            log.debug("Wrote schedule snapshot with {} entries to {}", snapshot.getScheduleCount(), SCHEDULE_CACHE);
        } catch (DataAccessException | SerializationException e) {
            throw new StoreException("Failed to write schedule snapshot to Redis", e);
        }
    }
}
