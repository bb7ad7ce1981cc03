package com.example.reminder.shared.exception;

import lombok.Getter;

/**
 * Malformed or unsupported recurrence/reminder data. Affects a single schedule only.
 */
@Getter
public class ComputationException extends ReminderException {

    private final String scheduleId;

    public ComputationException(String message) {
        this(message, null);
    }

    public ComputationException(String message, String scheduleId) {
        super(message);
        this.scheduleId = scheduleId;
    }

    public ComputationException withScheduleId(String id) {
        ComputationException copy = new ComputationException(getMessage(), id);
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
