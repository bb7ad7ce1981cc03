package com.example.reminder.cron.service;

import com.example.reminder.cron.dto.ReminderMessage;
import com.example.reminder.shared.model.CachedSchedule;
import com.example.reminder.shared.model.RecurrenceRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ReminderMessageFactoryTest {

    private final ReminderMessageFactory factory = new ReminderMessageFactory(ZoneOffset.ofHours(8), "O&M");

    // 2025-03-10 17:00 at +08:00
    private static final Instant DEADLINE = Instant.parse("2025-03-10T09:00:00Z");

    @Test
    @DisplayName("deadline is rendered in the fixed offset, not UTC")
    void formatDeadline() {
        assertThat(factory.formatDeadline(DEADLINE)).isEqualTo("Monday, March 10, 2025 05:00 PM");
    }

    @Test
    void createsSubjectAndBody() {
        CachedSchedule schedule = CachedSchedule.builder()
                .id("s1")
                .title("Generator check")
                .description("Check fuel level")
                .recurrence(new RecurrenceRule.Daily("17:00"))
                .assigneeName("Juan")
                .build();

        ReminderMessage message = factory.create(schedule, DEADLINE);

        assertThat(message.subject()).isEqualTo("Reminder: Generator check");
        assertThat(message.body())
                .startsWith("REMINDER: Generator check\n\nCheck fuel level\n\n")
                .contains("Deadline: Monday, March 10, 2025 05:00 PM\n")
                .contains("Schedule: Daily at 17:00\n")
                .contains("Assigned to: Juan\n")
                .endsWith("This is an automated reminder from O&M.");
    }

    @Test
    void omitsBlankDescription() {
        CachedSchedule schedule = CachedSchedule.builder().id("s1").title("T").description(" ").build();

        assertThat(factory.create(schedule, DEADLINE).body())
                .startsWith("REMINDER: T\n\nDeadline:")
                .contains("Schedule: Scheduled\n");
    }

    static Stream<Arguments> descriptions() {
        return Stream.of(
                Arguments.of(new RecurrenceRule.Daily(null), "Daily"),
                Arguments.of(new RecurrenceRule.Weekly(1, "08:00"), "Every Monday at 08:00"),
                Arguments.of(new RecurrenceRule.MonthlyByDay(15, null), "Monthly on day 15"),
                Arguments.of(new RecurrenceRule.MonthlySpecificDate(12, 25, null), "Annually on December 25"),
                Arguments.of(new RecurrenceRule.Interval(3, null), "Every 3 day(s)"),
                Arguments.of(new RecurrenceRule.Hourly(1), "Every hour"),
                Arguments.of(new RecurrenceRule.Hourly(4), "Every 4 hours"),
                Arguments.of(new RecurrenceRule.PerMinute(1), "Every minute"),
                Arguments.of(new RecurrenceRule.PerMinute(15), "Every 15 minutes"),
                Arguments.of(new RecurrenceRule.Custom("0 9 * * 1"), "Custom schedule"));
    }

    @ParameterizedTest
    @MethodSource("descriptions")
    void describesRule(RecurrenceRule rule, String expected) {
        assertThat(factory.describe(rule)).isEqualTo(expected);
    }
}
