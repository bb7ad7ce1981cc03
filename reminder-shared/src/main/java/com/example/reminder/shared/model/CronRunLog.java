package com.example.reminder.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit row written once per tick.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CronRunLog {
    private Long id;
    private Instant timestamp;
    private Long intervalMs;
    private int checked;
    private int sent;
    private int skipped;
    private int errors;
}
