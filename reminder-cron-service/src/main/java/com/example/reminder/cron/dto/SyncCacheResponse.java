package com.example.reminder.cron.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class SyncCacheResponse {
    private final int reminderCount;
    private final Instant syncedAt;
}
