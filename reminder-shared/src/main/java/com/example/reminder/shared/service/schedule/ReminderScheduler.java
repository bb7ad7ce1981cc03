package com.example.reminder.shared.service.schedule;

import com.example.reminder.shared.config.AppProperties;
import com.example.reminder.shared.exception.ComputationException;
import com.example.reminder.shared.model.ReminderRule;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;

/**
 * Turns a reminder rule and a deadline into the instant the notification should fire.
 *
 * <p>Relative rules subtract whole local days from the deadline's date and then set the
 * time of day. {@code daysBefore = 0} means the deadline's own day; whether the chosen time
 * precedes the deadline is not checked here.
 */
@Component
public class ReminderScheduler {

    static final LocalTime DEFAULT_TIME = LocalTime.of(9, 0);

    private final WallClock wallClock;

    @Autowired
    public ReminderScheduler(AppProperties appProperties) {
        this(appProperties.getZoneOffset());
    }

    public ReminderScheduler(ZoneOffset offset) {
        this.wallClock = new WallClock(offset);
    }

    public Instant reminderInstant(ReminderRule rule, Instant deadline) {
        if (rule == null) {
            throw new ComputationException("Reminder rule is missing");
        }
        return rule.accept(new ReminderRule.Visitor<>() {
            @Override
            public Instant visitRelative(ReminderRule.Relative relative) {
                int daysBefore = relative.daysBefore();
                if (daysBefore < 0) {
                    throw new ComputationException("daysBefore must not be negative, was " + daysBefore);
                }
                LocalTime time = WallClock.parseTime(relative.time(), DEFAULT_TIME);
                LocalDate day = wallClock.localDate(deadline).minusDays(daysBefore);
                return wallClock.at(day, time);
            }

            @Override
            public Instant visitAbsolute(ReminderRule.Absolute absolute) {
                if (absolute.dateTime() == null) {
                    throw new ComputationException("Absolute reminder has no dateTime");
                }
                return absolute.dateTime();
            }
        });
    }
}
