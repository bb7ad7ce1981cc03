package com.example.reminder.shared.exception;

/**
 * Base type for failures raised by the reminder engine and its stores.
 */
public class ReminderException extends RuntimeException {

    public ReminderException(String message) {
        super(message);
    }

    public ReminderException(String message, Throwable cause) {
        super(message, cause);
    }
}
