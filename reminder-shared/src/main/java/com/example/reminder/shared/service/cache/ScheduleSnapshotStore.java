package com.example.reminder.shared.service.cache;

import com.example.reminder.shared.model.ScheduleCacheSnapshot;

import java.util.Optional;

/**
 * Holds the single schedule snapshot blob. Implementations throw
 * {@link com.example.reminder.shared.exception.StoreException} when unreachable.
 */
public interface ScheduleSnapshotStore {

    Optional<ScheduleCacheSnapshot> load();

    void replace(ScheduleCacheSnapshot snapshot);
}
