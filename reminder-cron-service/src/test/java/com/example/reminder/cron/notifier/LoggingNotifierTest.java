package com.example.reminder.cron.notifier;

import com.example.reminder.shared.notifier.NotificationResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingNotifierTest {

    private final LoggingNotifier notifier = new LoggingNotifier();

    @Test
    void logsAndReturnsMessageId() {
        NotificationResult result = notifier.send("juan@example.com", "Reminder: Task", "body");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessageId()).startsWith("<").endsWith("@log.reminder>");
    }

    @Test
    void blankRecipientFails() {
        NotificationResult result = notifier.send("", "Reminder: Task", "body");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("No recipient address");
    }
}
