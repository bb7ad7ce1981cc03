package com.example.reminder.shared.service.schedule;

import com.example.reminder.shared.exception.ComputationException;
import com.example.reminder.shared.model.ReminderRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReminderSchedulerTest {

    private static final ZoneOffset PH = ZoneOffset.ofHours(8);

    private final ReminderScheduler scheduler = new ReminderScheduler(PH);

    private static Instant local(String dateTime) {
        return LocalDateTime.parse(dateTime).toInstant(PH);
    }

    @Test
    @DisplayName("zero days before means earlier on the deadline's own day")
    void sameDay() {
        Instant reminder = scheduler.reminderInstant(new ReminderRule.Relative(0, "08:00"), local("2025-03-10T17:00"));
        assertThat(reminder).isEqualTo(local("2025-03-10T08:00"));
    }

    @Test
    @DisplayName("defaults to one day before at 09:00")
    void defaults() {
        Instant reminder = scheduler.reminderInstant(new ReminderRule.Relative(null, null), local("2025-03-10T17:00"));
        assertThat(reminder).isEqualTo(local("2025-03-09T09:00"));
    }

    @Test
    @DisplayName("subtracts local calendar days across a month boundary")
    void acrossMonth() {
        Instant reminder = scheduler.reminderInstant(new ReminderRule.Relative(3, "09:00"), local("2025-03-02T17:00"));
        assertThat(reminder).isEqualTo(local("2025-02-27T09:00"));
    }

    @Test
    @DisplayName("works on the local date even when the UTC date differs")
    void localDate() {
        // 2025-03-10T01:00 at +08:00 is still the 9th in UTC
        Instant reminder = scheduler.reminderInstant(new ReminderRule.Relative(0, "00:30"), local("2025-03-10T01:00"));
        assertThat(reminder).isEqualTo(local("2025-03-10T00:30"));
    }

    @Test
    @DisplayName("absolute reminders ignore the deadline")
    void absolute() {
        Instant fixed = Instant.parse("2025-01-05T02:00:00Z");
        Instant reminder = scheduler.reminderInstant(new ReminderRule.Absolute(fixed), local("2025-03-10T17:00"));
        assertThat(reminder).isEqualTo(fixed);
    }

    @Test
    void absoluteWithoutInstantIsRejected() {
        assertThatThrownBy(() -> scheduler.reminderInstant(new ReminderRule.Absolute(null), local("2025-03-10T17:00")))
                .isInstanceOf(ComputationException.class);
    }

    @Test
    void negativeDaysBeforeIsRejected() {
        assertThatThrownBy(() -> scheduler.reminderInstant(new ReminderRule.Relative(-1, "08:00"), local("2025-03-10T17:00")))
                .isInstanceOf(ComputationException.class)
                .hasMessageContaining("daysBefore");
    }

    @Test
    void missingRuleIsRejected() {
        assertThatThrownBy(() -> scheduler.reminderInstant(null, local("2025-03-10T17:00")))
                .isInstanceOf(ComputationException.class);
    }
}
