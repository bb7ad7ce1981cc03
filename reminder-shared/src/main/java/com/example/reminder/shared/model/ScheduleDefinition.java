package com.example.reminder.shared.model;

import com.example.reminder.shared.util.Constants.ScheduleStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A recurring task as held by the source of truth.
 * Only {@link ScheduleStatus#ACTIVE} schedules take part in reminder dispatch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleDefinition {
    private String id;
    private String ownerId;
    private String title;
    private String description;
    private RecurrenceRule recurrence;
    private ReminderRule reminder;
    private String assigneeName;
    private String assigneeEmail;
    private ScheduleStatus status;
    private Instant createdAt;
    private Instant updatedAt;
    /**
     * Set when the stored rule data could not be read; recurrence and reminder are then null.
     */
    private String ruleError;
}
