package com.example.reminder.cron.notifier;

import com.example.reminder.shared.notifier.NotificationResult;
import com.example.reminder.shared.notifier.Notifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Writes reminders to the log instead of delivering them. Default for local runs.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "reminder.notifier", name = "type", havingValue = "log", matchIfMissing = true)
public class LoggingNotifier implements Notifier {

    @Override
    public NotificationResult send(String recipient, String subject, String body) {
        if (recipient == null || recipient.isBlank()) {
            return NotificationResult.failure("No recipient address");
        }
        String messageId = "<" + UUID.randomUUID() + "@log.reminder>";
        log.info("Reminder for {} [{}]: {}\n{}", recipient, messageId, subject, body);
        return NotificationResult.success(messageId);
    }
}
