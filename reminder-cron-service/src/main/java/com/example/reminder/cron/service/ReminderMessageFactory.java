package com.example.reminder.cron.service;

import com.example.reminder.cron.dto.ReminderMessage;
import com.example.reminder.shared.config.AppProperties;
import com.example.reminder.shared.model.CachedSchedule;
import com.example.reminder.shared.model.RecurrenceRule;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.Month;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Plain-text reminder mail for a schedule and its upcoming deadline.
 */
@Component
public class ReminderMessageFactory {

    private static final DateTimeFormatter DEADLINE_FORMAT =
            DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy hh:mm a", Locale.US);
    private static final String[] DAY_NAMES =
            {"Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday"};

    private final ZoneOffset offset;
    private final String senderName;

    @Autowired
    public ReminderMessageFactory(AppProperties appProperties) {
        this(appProperties.getZoneOffset(), appProperties.getNotifier().getSenderName());
    }

    public ReminderMessageFactory(ZoneOffset offset, String senderName) {
        this.offset = offset;
        this.senderName = senderName;
    }

    public ReminderMessage create(CachedSchedule schedule, Instant deadline) {
        String subject = "Reminder: " + schedule.getTitle();

        StringBuilder body = new StringBuilder();
        body.append("REMINDER: ").append(schedule.getTitle()).append("\n\n");
        if (schedule.getDescription() != null && !schedule.getDescription().isBlank()) {
            body.append(schedule.getDescription()).append("\n\n");
        }
        body.append("Deadline: ").append(formatDeadline(deadline)).append('\n');
        body.append("Schedule: ").append(describe(schedule.getRecurrence())).append('\n');
        body.append("Assigned to: ").append(schedule.getAssigneeName()).append("\n\n");
        body.append("---\n");
        body.append("This is an automated reminder from ").append(senderName).append('.');

        return new ReminderMessage(subject, body.toString());
    }

    public String formatDeadline(Instant deadline) {
        return DEADLINE_FORMAT.format(deadline.atOffset(offset));
    }

    public String describe(RecurrenceRule rule) {
        if (rule == null) {
            return "Scheduled";
        }
        return rule.accept(DESCRIPTION);
    }

    private static String at(String time) {
        return time != null && !time.isBlank() ? " at " + time : "";
    }

    private static final RecurrenceRule.Visitor<String> DESCRIPTION = new RecurrenceRule.Visitor<>() {
        @Override
        public String visitDaily(RecurrenceRule.Daily rule) {
            return "Daily" + at(rule.time());
        }

        @Override
        public String visitWeekly(RecurrenceRule.Weekly rule) {
            int day = Math.floorMod(rule.dayOfWeek(), 7);
            return "Every " + DAY_NAMES[day] + at(rule.time());
        }

        @Override
        public String visitMonthlyByDay(RecurrenceRule.MonthlyByDay rule) {
            return "Monthly on day " + rule.dayOfMonth() + at(rule.time());
        }

        @Override
        public String visitMonthlySpecificDate(RecurrenceRule.MonthlySpecificDate rule) {
            String month = rule.month() >= 1 && rule.month() <= 12
                    ? Month.of(rule.month()).getDisplayName(TextStyle.FULL, Locale.US)
                    : String.valueOf(rule.month());
            return "Annually on " + month + " " + rule.day() + at(rule.time());
        }

        @Override
        public String visitInterval(RecurrenceRule.Interval rule) {
            return "Every " + rule.days() + " day(s)" + at(rule.time());
        }

        @Override
        public String visitHourly(RecurrenceRule.Hourly rule) {
            return rule.hours() == 1 ? "Every hour" : "Every " + rule.hours() + " hours";
        }

        @Override
        public String visitPerMinute(RecurrenceRule.PerMinute rule) {
            return rule.minutes() == 1 ? "Every minute" : "Every " + rule.minutes() + " minutes";
        }

        @Override
        public String visitCustom(RecurrenceRule.Custom rule) {
            return "Custom schedule";
        }
    };
}
