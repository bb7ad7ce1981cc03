package com.example.reminder.shared.exception;

/**
 * A marker, snapshot or source store could not be reached or returned unreadable data.
 */
public class StoreException extends ReminderException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
