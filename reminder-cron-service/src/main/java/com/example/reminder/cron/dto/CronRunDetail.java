package com.example.reminder.cron.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome for one schedule within a tick.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CronRunDetail {
    private String scheduleId;
    private String title;
    private DetailStatus status;
    private String reason;

    public static CronRunDetail sent(String scheduleId, String title, String reason) {
        return new CronRunDetail(scheduleId, title, DetailStatus.SENT, reason);
    }

    public static CronRunDetail skipped(String scheduleId, String title, String reason) {
        return new CronRunDetail(scheduleId, title, DetailStatus.SKIPPED, reason);
    }

    public static CronRunDetail error(String scheduleId, String title, String reason) {
        return new CronRunDetail(scheduleId, title, DetailStatus.ERROR, reason);
    }
}
