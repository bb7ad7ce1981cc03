package com.example.reminder.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Record that a reminder was sent for one schedule in one time bucket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SentMarker {
    private String key;
    private String scheduleId;
    private String bucket;
    private Granularity granularity;
    private Instant sentAt;
    private String recipient;
    private String scheduleTitle;
    private String messageId;
}
