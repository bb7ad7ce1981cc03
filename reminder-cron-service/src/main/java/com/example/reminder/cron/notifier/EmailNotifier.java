package com.example.reminder.cron.notifier;

import com.example.reminder.shared.config.AppProperties;
import com.example.reminder.shared.exception.DispatchException;
import com.example.reminder.shared.notifier.NotificationResult;
import com.example.reminder.shared.notifier.Notifier;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;

/**
 * SMTP delivery through Spring's {@link JavaMailSender}. Failures trip the {@code notifier}
 * circuit breaker; the fallback turns every failure, including an open circuit, into a
 * failed {@link NotificationResult}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "reminder.notifier", name = "type", havingValue = "email")
public class EmailNotifier implements Notifier {

    private final JavaMailSender mailSender;
    private final AppProperties appProperties;

    @Override
    @CircuitBreaker(name = "notifier", fallbackMethod = "sendFallback")
    public NotificationResult send(String recipient, String subject, String body) {
        if (recipient == null || recipient.isBlank()) {
            throw new DispatchException("No recipient address", recipient);
        }
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, StandardCharsets.UTF_8.name());
            AppProperties.Notifier config = appProperties.getNotifier();
            helper.setFrom(config.getFrom(), config.getSenderName());
            helper.setTo(recipient);
            helper.setSubject(subject);
            helper.setText(body, false);

            mailSender.send(message);
            String messageId = message.getMessageID();
            log.info("Reminder mail sent to {} (Message ID: {})", recipient, messageId);
            return NotificationResult.success(messageId);
        } catch (MailException | MessagingException | UnsupportedEncodingException e) {
            throw new DispatchException("Failed to send reminder mail: " + e.getMessage(), recipient, e);
        }
    }

    public NotificationResult sendFallback(String recipient, String subject, String body, Throwable t) {
        log.error("Reminder mail to {} not sent: {}", recipient, t.getMessage());
        return NotificationResult.failure(t.getMessage());
    }
}
