package com.example.reminder.shared.service.marker;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * What gets recorded alongside a sent marker.
 */
@Value
@Builder
public class MarkerMetadata {
    String scheduleId;
    String recipient;
    String scheduleTitle;
    String messageId;
    Instant sentAt;
}
