package com.example.reminder.cron;

import com.example.reminder.shared.config.CorrelationIdFilter;
import io.micrometer.context.ContextRegistry;
import org.slf4j.MDC;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;
import reactor.core.publisher.Hooks;

/**
 * Reminder dispatch service.
 *
 * <p>Each tick reads the cached schedule snapshot, works out which reminders are due in the
 * dispatch window, sends them through the configured notifier and records a sent marker so
 * the same reminder is not sent twice in one period. Ticks come from an external caller of
 * {@code /api/cron/send-reminders} or, when enabled, from the internal ShedLock-guarded job.
 */
@SpringBootApplication
@ComponentScan("com.example.reminder")
public class ReminderCronApplication {

    static {
        // Carries the MDC correlation id across Reactor scheduler hops.
        String key = CorrelationIdFilter.CORRELATION_ID_KEY;
        ContextRegistry.getInstance().registerThreadLocalAccessor(
                key, () -> MDC.get(key), value -> MDC.put(key, value), () -> MDC.remove(key));
        Hooks.enableAutomaticContextPropagation();
    }

    public static void main(String[] args) {
        SpringApplication.run(ReminderCronApplication.class, args);
    }
}
