package com.example.reminder.shared.notifier;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NotificationResult {
    boolean success;
    String messageId;
    String error;

    public static NotificationResult success(String messageId) {
        return new NotificationResult(true, messageId, null);
    }

    public static NotificationResult failure(String error) {
        return new NotificationResult(false, null, error);
    }
}
