package com.example.reminder.shared.service.schedule;

import com.example.reminder.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether "now" is close enough to a reminder instant to send it.
 *
 * <p>The window is {@code [reminder - before, reminder + after]}, both ends inclusive,
 * by default 2 minutes before and 3 minutes after. It is wider than the trigger cadence
 * so a once-a-minute caller neither misses a reminder nor needs second precision.
 */
@Component
public class DispatchWindowChecker {

    public static final Duration DEFAULT_BEFORE = Duration.ofMinutes(2);
    public static final Duration DEFAULT_AFTER = Duration.ofMinutes(3);

    private final Duration before;
    private final Duration after;

    @Autowired
    public DispatchWindowChecker(AppProperties appProperties) {
        this(appProperties.getWindow().getBefore(), appProperties.getWindow().getAfter());
    }

    public DispatchWindowChecker(Duration before, Duration after) {
        this.before = before;
        this.after = after;
    }

    public static DispatchWindowChecker withDefaults() {
        return new DispatchWindowChecker(DEFAULT_BEFORE, DEFAULT_AFTER);
    }

    public boolean shouldFireNow(Instant reminderInstant, Instant now) {
        return !now.isBefore(reminderInstant.minus(before)) && !now.isAfter(reminderInstant.plus(after));
    }
}
