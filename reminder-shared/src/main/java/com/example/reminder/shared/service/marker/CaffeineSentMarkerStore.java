package com.example.reminder.shared.service.marker;

import com.example.reminder.shared.model.SentMarker;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Single-process marker store. Not shared between instances; use the Redis store for that.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "reminder.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class CaffeineSentMarkerStore implements SentMarkerStore {

    private final Cache<String, SentMarker> sentMarkerCache;

    @Override
    public Optional<SentMarker> find(String key) {
        return Optional.ofNullable(sentMarkerCache.getIfPresent(key));
    }

    @Override
    public void save(SentMarker marker) {
        sentMarkerCache.put(marker.getKey(), marker);
    }

    @Override
    public boolean saveIfAbsent(SentMarker marker) {
        return sentMarkerCache.asMap().putIfAbsent(marker.getKey(), marker) == null;
    }

    @Override
    public boolean delete(String key) {
        return sentMarkerCache.asMap().remove(key) != null;
    }

    @Override
    public List<String> findKeysSentBefore(Instant cutoff, int limit) {
        return sentMarkerCache.asMap().values().stream()
                .filter(marker -> marker.getSentAt() != null && marker.getSentAt().isBefore(cutoff))
                .sorted(Comparator.comparing(SentMarker::getSentAt))
                .limit(limit)
                .map(SentMarker::getKey)
                .collect(Collectors.toList());
    }

    @Override
    public int deleteAll(Collection<String> keys) {
        int removed = 0;
        for (String key : keys) {
            if (delete(key)) {
                removed++;
            }
        }
        log.debug("Removed {} of {} requested markers from the local store.", removed, keys.size());
        return removed;
    }
}
