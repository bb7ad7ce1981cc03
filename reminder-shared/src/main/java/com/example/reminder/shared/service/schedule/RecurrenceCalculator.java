package com.example.reminder.shared.service.schedule;

import com.example.reminder.shared.config.AppProperties;
import com.example.reminder.shared.exception.ComputationException;
import com.example.reminder.shared.model.RecurrenceRule;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneOffset;

/**
 * Computes the next deadline of a recurrence rule.
 *
 * <p>All wall-clock arithmetic happens at the configured fixed offset and the result is
 * converted back to an absolute instant. The result is always strictly after the reference
 * instant: when the naive candidate has already passed, it rolls forward by one period.
 *
 * <p>Custom rules are not evaluated. They resolve to {@code reference + 365 days}, a far-future
 * sentinel that callers must not treat as a real deadline (see {@link RecurrenceRule#resolvable()}).
 */
@Component
public class RecurrenceCalculator {

    static final Duration CUSTOM_HORIZON = Duration.ofDays(365);

    private static final long DAY_MILLIS = Duration.ofDays(1).toMillis();

    private final WallClock wallClock;

    @Autowired
    public RecurrenceCalculator(AppProperties appProperties) {
        this(appProperties.getZoneOffset());
    }

    public RecurrenceCalculator(ZoneOffset offset) {
        this.wallClock = new WallClock(offset);
    }

    public Instant nextDeadline(RecurrenceRule rule, Instant reference) {
        return nextDeadline(rule, reference, null);
    }

    /**
     * @param rule            the recurrence rule
     * @param reference       instant the result must be strictly after
     * @param creationInstant anchor for interval rules; {@code reference} is used when {@code null}
     * @return the next deadline, strictly after {@code reference}
     * @throws ComputationException if the rule is missing or holds out-of-range values
     */
    public Instant nextDeadline(RecurrenceRule rule, Instant reference, Instant creationInstant) {
        if (rule == null) {
            throw new ComputationException("Recurrence rule is missing");
        }
        if (reference == null) {
            throw new ComputationException("Reference instant is missing");
        }
        return rule.accept(new DeadlineVisitor(reference, creationInstant != null ? creationInstant : reference));
    }

    private final class DeadlineVisitor implements RecurrenceRule.Visitor<Instant> {

        private final Instant reference;
        private final Instant anchor;
        private final LocalDateTime localReference;

        private DeadlineVisitor(Instant reference, Instant anchor) {
            this.reference = reference;
            this.anchor = anchor;
            this.localReference = wallClock.local(reference);
        }

        @Override
        public Instant visitDaily(RecurrenceRule.Daily rule) {
            LocalTime time = WallClock.parseTime(rule.time(), WallClock.END_OF_DAY);
            LocalDate today = localReference.toLocalDate();
            Instant candidate = wallClock.at(today, time);
            if (passed(candidate)) {
                candidate = wallClock.at(today.plusDays(1), time);
            }
            return candidate;
        }

        @Override
        public Instant visitWeekly(RecurrenceRule.Weekly rule) {
            int target = rule.dayOfWeek();
            if (target < 0 || target > 6) {
                throw new ComputationException("dayOfWeek must be between 0 (Sunday) and 6, was " + target);
            }
            LocalTime time = WallClock.parseTime(rule.time(), WallClock.END_OF_DAY);
            LocalDate today = localReference.toLocalDate();
            int current = today.getDayOfWeek().getValue() % 7;
            int delta = Math.floorMod(target - current, 7);
            if (delta == 0 && passed(wallClock.at(today, time))) {
                delta = 7;
            }
            return wallClock.at(today.plusDays(delta), time);
        }

        @Override
        public Instant visitMonthlyByDay(RecurrenceRule.MonthlyByDay rule) {
            int dayOfMonth = rule.dayOfMonth();
            if (dayOfMonth < 1 || dayOfMonth > 31) {
                throw new ComputationException("dayOfMonth must be between 1 and 31, was " + dayOfMonth);
            }
            LocalTime time = WallClock.parseTime(rule.time(), WallClock.END_OF_DAY);
            YearMonth month = YearMonth.from(localReference);
            Instant candidate = wallClock.at(clamp(month, dayOfMonth), time);
            if (passed(candidate)) {
                candidate = wallClock.at(clamp(month.plusMonths(1), dayOfMonth), time);
            }
            return candidate;
        }

        @Override
        public Instant visitMonthlySpecificDate(RecurrenceRule.MonthlySpecificDate rule) {
            int month = rule.month();
            int day = rule.day();
            if (month < 1 || month > 12) {
                throw new ComputationException("month must be between 1 and 12, was " + month);
            }
            if (day < 1 || day > 31) {
                throw new ComputationException("day must be between 1 and 31, was " + day);
            }
            LocalTime time = WallClock.parseTime(rule.time(), WallClock.END_OF_DAY);
            int year = localReference.getYear();
            Instant candidate = wallClock.at(clamp(YearMonth.of(year, month), day), time);
            if (passed(candidate)) {
                candidate = wallClock.at(clamp(YearMonth.of(year + 1, month), day), time);
            }
            return candidate;
        }

        @Override
        public Instant visitInterval(RecurrenceRule.Interval rule) {
            int days = rule.days();
            if (days < 1) {
                throw new ComputationException("Interval days must be positive, was " + days);
            }
            LocalTime time = WallClock.parseTime(rule.time(), WallClock.END_OF_DAY);
            // Bucket from the anchor so repeated evaluation does not drift.
            long elapsedDays = Math.floorDiv(Duration.between(anchor, reference).toMillis(), DAY_MILLIS);
            long periodsElapsed = Math.floorDiv(elapsedDays, days);
            LocalDate date = wallClock.localDate(anchor).plusDays(periodsElapsed * days);
            Instant candidate = wallClock.at(date, time);
            while (passed(candidate)) {
                date = date.plusDays(days);
                candidate = wallClock.at(date, time);
            }
            return candidate;
        }

        @Override
        public Instant visitHourly(RecurrenceRule.Hourly rule) {
            int hours = rule.hours();
            if (hours < 1) {
                throw new ComputationException("Hourly interval must be positive, was " + hours);
            }
            int bucketHour = (localReference.getHour() / hours) * hours;
            LocalDateTime slot = localReference.toLocalDate().atTime(bucketHour, 0);
            while (passed(wallClock.at(slot))) {
                slot = slot.plusHours(hours);
            }
            return wallClock.at(slot);
        }

        @Override
        public Instant visitPerMinute(RecurrenceRule.PerMinute rule) {
            int minutes = rule.minutes();
            if (minutes < 1) {
                throw new ComputationException("Minute interval must be positive, was " + minutes);
            }
            int bucketMinute = (localReference.getMinute() / minutes) * minutes;
            LocalDateTime slot = localReference.toLocalDate()
                    .atTime(localReference.getHour(), bucketMinute);
            while (passed(wallClock.at(slot))) {
                slot = slot.plusMinutes(minutes);
            }
            return wallClock.at(slot);
        }

        @Override
        public Instant visitCustom(RecurrenceRule.Custom rule) {
            return reference.plus(CUSTOM_HORIZON);
        }

        private boolean passed(Instant candidate) {
            return !candidate.isAfter(reference);
        }
    }

    private static LocalDate clamp(YearMonth month, int dayOfMonth) {
        return month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
    }
}
