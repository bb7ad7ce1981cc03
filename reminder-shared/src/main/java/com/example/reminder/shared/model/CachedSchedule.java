package com.example.reminder.shared.model;

import com.example.reminder.shared.util.Constants.ScheduleStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot entry: a schedule definition without owner and audit fields.
 * The creation instant is not retained, so interval rules are evaluated against a fixed anchor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedSchedule {
    private String id;
    private String title;
    private String description;
    private RecurrenceRule recurrence;
    private ReminderRule reminder;
    private String assigneeName;
    private String assigneeEmail;
    private ScheduleStatus status;
    private String ruleError;

    public static CachedSchedule from(ScheduleDefinition definition) {
        return CachedSchedule.builder()
                .id(definition.getId())
                .title(definition.getTitle())
                .description(definition.getDescription())
                .recurrence(definition.getRecurrence())
                .reminder(definition.getReminder())
                .assigneeName(definition.getAssigneeName())
                .assigneeEmail(definition.getAssigneeEmail())
                .status(definition.getStatus())
                .ruleError(definition.getRuleError())
                .build();
    }
}
