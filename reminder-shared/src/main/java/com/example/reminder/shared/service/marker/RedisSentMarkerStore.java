package com.example.reminder.shared.service.marker;

import com.example.reminder.shared.exception.StoreException;
import com.example.reminder.shared.model.SentMarker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static com.example.reminder.shared.util.Constants.RedisKeys.SENT_MARKERS_BY_TIME;
import static com.example.reminder.shared.util.Constants.RedisKeys.SENT_MARKER_PREFIX;

/**
 * Marker store shared by every instance. Each marker is a JSON value under
 * {@code sent-reminder:<key>}; a sorted set scored by sent time drives cleanup.
 */
@Service
@Slf4j
@ConditionalOnProperty(prefix = "reminder.store", name = "type", havingValue = "redis")
public class RedisSentMarkerStore implements SentMarkerStore {

    private final RedisTemplate<String, SentMarker> sentMarkerRedisTemplate;
    private final StringRedisTemplate stringRedisTemplate;

    public RedisSentMarkerStore(@Qualifier("sentMarkerRedisTemplate") RedisTemplate<String, SentMarker> sentMarkerRedisTemplate,
                                StringRedisTemplate stringRedisTemplate) {
        this.sentMarkerRedisTemplate = sentMarkerRedisTemplate;
        this.stringRedisTemplate = stringRedisTemplate;
    }

    @Override
    public Optional<SentMarker> find(String key) {
        try {
            return Optional.ofNullable(sentMarkerRedisTemplate.opsForValue().get(SENT_MARKER_PREFIX + key));
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read sent marker " + key, e);
        }
    }

    @Override
    public void save(SentMarker marker) {
        try {
            sentMarkerRedisTemplate.opsForValue().set(SENT_MARKER_PREFIX + marker.getKey(), marker);
            index(marker);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to write sent marker " + marker.getKey(), e);
        }
    }

    @Override
    public boolean saveIfAbsent(SentMarker marker) {
        try {
            Boolean inserted = sentMarkerRedisTemplate.opsForValue().setIfAbsent(SENT_MARKER_PREFIX + marker.getKey(), marker);
            if (Boolean.TRUE.equals(inserted)) {
                index(marker);
                return true;
            }
            return false;
        } catch (DataAccessException e) {
            throw new StoreException("Failed to claim sent marker " + marker.getKey(), e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            stringRedisTemplate.opsForZSet().remove(SENT_MARKERS_BY_TIME, key);
            return Boolean.TRUE.equals(sentMarkerRedisTemplate.delete(SENT_MARKER_PREFIX + key));
        } catch (DataAccessException e) {
            throw new StoreException("Failed to delete sent marker " + key, e);
        }
    }

    @Override
    public List<String> findKeysSentBefore(Instant cutoff, int limit) {
        try {
            Set<String> keys = stringRedisTemplate.opsForZSet()
                    .rangeByScore(SENT_MARKERS_BY_TIME, 0, cutoff.toEpochMilli() - 1, 0, limit);
            return keys != null ? new ArrayList<>(keys) : List.of();
        } catch (DataAccessException e) {
            throw new StoreException("Failed to scan sent markers older than " + cutoff, e);
        }
    }

    @Override
    public int deleteAll(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        try {
            List<String> valueKeys = keys.stream().map(k -> SENT_MARKER_PREFIX + k).collect(Collectors.toList());
            Long deleted = sentMarkerRedisTemplate.delete(valueKeys);
            stringRedisTemplate.opsForZSet().remove(SENT_MARKERS_BY_TIME, keys.toArray());
            log.debug("Deleted {} sent markers from Redis.", deleted);
            return deleted != null ? deleted.intValue() : 0;
        } catch (DataAccessException e) {
            throw new StoreException("Failed to delete " + keys.size() + " sent markers", e);
        }
    }

    private void index(SentMarker marker) {
        stringRedisTemplate.opsForZSet().add(SENT_MARKERS_BY_TIME, marker.getKey(), marker.getSentAt().toEpochMilli());
    }
}
