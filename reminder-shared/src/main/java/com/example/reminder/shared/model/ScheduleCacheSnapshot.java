package com.example.reminder.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The whole materialized set of active schedules. Replaced wholesale on every sync.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleCacheSnapshot {
    @Builder.Default
    private List<CachedSchedule> schedules = new ArrayList<>();
    private Instant lastSynced;
    private int scheduleCount;
}
