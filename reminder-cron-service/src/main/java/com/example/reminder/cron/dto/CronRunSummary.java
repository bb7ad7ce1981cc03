package com.example.reminder.cron.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of one reminder tick, returned by the trigger endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CronRunSummary {
    private int checked;
    private int sent;
    private int skipped;
    private int errors;
    private int cleanedUp;
    private boolean cacheHit;
    private boolean needsSync;
    private long durationMs;
    private Instant timestamp;
    private Long intervalSinceLastRunMs;
    private String message;
    @Builder.Default
    private List<CronRunDetail> details = new ArrayList<>();
}
