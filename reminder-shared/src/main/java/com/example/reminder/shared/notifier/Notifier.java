package com.example.reminder.shared.notifier;

/**
 * Delivers one reminder message. Implementations may block on network I/O.
 */
public interface Notifier {

    /**
     * Never throws for delivery problems; those come back as {@link NotificationResult#failure}.
     */
    NotificationResult send(String recipient, String subject, String body);
}
