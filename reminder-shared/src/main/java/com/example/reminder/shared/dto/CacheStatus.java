package com.example.reminder.shared.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

/**
 * Diagnostic view of the schedule snapshot.
 */
@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CacheStatus {
    private final boolean exists;
    private final Instant lastSynced;
    private final Integer count;

    public static CacheStatus missing() {
        return new CacheStatus(false, null, null);
    }
}
