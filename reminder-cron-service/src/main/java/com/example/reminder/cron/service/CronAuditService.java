package com.example.reminder.cron.service;

import com.example.reminder.cron.dto.CronRunSummary;
import com.example.reminder.shared.model.CronRunLog;
import com.example.reminder.shared.repository.CronRunLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Appends one row per tick to {@code cron_logs}. An audit failure never fails the tick.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CronAuditService {

    private final CronRunLogRepository cronRunLogRepository;

    /**
     * @return milliseconds since the previous recorded tick, or {@code null} for the first one
     *         or when the log is unavailable
     */
    public Long record(Instant finishedAt, CronRunSummary summary) {
        try {
            Long interval = cronRunLogRepository.findLatest()
                    .map(last -> Duration.between(last.getTimestamp(), finishedAt).toMillis())
                    .orElse(null);
            cronRunLogRepository.save(CronRunLog.builder()
                    .timestamp(finishedAt)
                    .intervalMs(interval)
                    .checked(summary.getChecked())
                    .sent(summary.getSent())
                    .skipped(summary.getSkipped())
                    .errors(summary.getErrors())
                    .build());
            if (interval != null) {
                log.debug("Recorded cron run, {}ms since the previous run", interval);
            }
            return interval;
        } catch (DataAccessException e) {
            log.warn("Could not write cron run audit entry: {}", e.getMessage());
            return null;
        }
    }
}
