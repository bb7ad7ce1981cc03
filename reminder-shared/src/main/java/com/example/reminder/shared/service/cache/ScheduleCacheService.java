package com.example.reminder.shared.service.cache;

import com.example.reminder.shared.aspect.Monitored;
import com.example.reminder.shared.dto.CacheStatus;
import com.example.reminder.shared.dto.CacheSyncResult;
import com.example.reminder.shared.model.CachedSchedule;
import com.example.reminder.shared.model.ScheduleCacheSnapshot;
import com.example.reminder.shared.model.ScheduleDefinition;
import com.example.reminder.shared.util.Constants.ScheduleStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Materialized view of the active schedules. The snapshot is only ever replaced as a whole;
 * there is no per-schedule invalidation, so any create, edit or delete needs a full {@link #sync}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Monitored("cache")
public class ScheduleCacheService {

    private final ScheduleSnapshotStore snapshotStore;
    private final Clock clock;

    public CacheSyncResult sync(SourceStore sourceStore) {
        try {
            List<ScheduleDefinition> active = sourceStore.listActive();
            List<CachedSchedule> schedules = active.stream()
                    .filter(s -> s.getStatus() == ScheduleStatus.ACTIVE)
                    .map(CachedSchedule::from)
                    .collect(Collectors.toList());
            Instant syncedAt = clock.instant();
            snapshotStore.replace(ScheduleCacheSnapshot.builder()
                    .schedules(schedules)
                    .lastSynced(syncedAt)
                    .scheduleCount(schedules.size())
                    .build());
            log.info("Schedule cache synced with {} active schedules", schedules.size());
            return CacheSyncResult.synced(schedules.size(), syncedAt);
        } catch (RuntimeException e) {
            log.error("Schedule cache sync failed", e);
            return CacheSyncResult.failed(e.getMessage());
        }
    }

    /**
     * Empty when the cache was never synced or cannot be read. Callers treat empty as
     * "needs sync", never as "no schedules".
     */
    public List<CachedSchedule> read() {
        try {
            return snapshotStore.load()
                    .map(ScheduleCacheSnapshot::getSchedules)
                    .orElse(List.of());
        } catch (RuntimeException e) {
            log.warn("Could not read schedule cache, treating it as empty: {}", e.getMessage());
            return List.of();
        }
    }

    public CacheStatus status() {
        try {
            return snapshotStore.load()
                    .map(s -> new CacheStatus(true, s.getLastSynced(), s.getScheduleCount()))
                    .orElseGet(CacheStatus::missing);
        } catch (RuntimeException e) {
            log.warn("Could not read schedule cache status: {}", e.getMessage());
            return CacheStatus.missing();
        }
    }
}
