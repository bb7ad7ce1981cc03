package com.example.reminder.shared.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CacheSyncResult {
    private final boolean success;
    private final int count;
    private final Instant syncedAt;
    private final String error;

    public static CacheSyncResult synced(int count, Instant syncedAt) {
        return new CacheSyncResult(true, count, syncedAt, null);
    }

    public static CacheSyncResult failed(String error) {
        return new CacheSyncResult(false, 0, null, error);
    }
}
