package com.example.reminder.shared.exception;

/**
 * Required configuration is missing. Raised at the boundary before any processing starts.
 */
public class ConfigurationException extends ReminderException {

    public ConfigurationException(String message) {
        super(message);
    }
}
