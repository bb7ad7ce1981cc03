package com.example.reminder.shared.exception;

import lombok.Getter;

/**
 * The notifier refused, failed or timed out. No sent marker is written for the schedule.
 */
@Getter
public class DispatchException extends ReminderException {

    private final String recipient;

    public DispatchException(String message, String recipient) {
        super(message);
        this.recipient = recipient;
    }

    public DispatchException(String message, String recipient, Throwable cause) {
        super(message, cause);
        this.recipient = recipient;
    }
}
