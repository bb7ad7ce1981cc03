package com.example.reminder.shared.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * How often a schedule's deadline repeats.
 *
 * <p>Wall-clock times are {@code HH:mm} strings interpreted in the configured fixed offset.
 * A missing time means end of day (23:59). Missing numeric fields take the defaults applied
 * by each record's compact constructor.
 *
 * <ul>
 *   <li>{@link Daily} - every day at a time
 *   <li>{@link Weekly} - one weekday (0 = Sunday .. 6 = Saturday)
 *   <li>{@link MonthlyByDay} - a day of every month, clamped to the month's length
 *   <li>{@link MonthlySpecificDate} - a month and day of every year
 *   <li>{@link Interval} - every N days from the creation anchor
 *   <li>{@link Hourly} - every N hours from local midnight
 *   <li>{@link PerMinute} - every N minutes from the top of the hour
 *   <li>{@link Custom} - cron expression, not evaluated
 * </ul>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RecurrenceRule.Daily.class, name = "daily"),
        @JsonSubTypes.Type(value = RecurrenceRule.Weekly.class, name = "weekly"),
        @JsonSubTypes.Type(value = RecurrenceRule.MonthlyByDay.class, name = "monthly"),
        @JsonSubTypes.Type(value = RecurrenceRule.MonthlySpecificDate.class, name = "monthly-specific"),
        @JsonSubTypes.Type(value = RecurrenceRule.Interval.class, name = "interval"),
        @JsonSubTypes.Type(value = RecurrenceRule.Hourly.class, name = "hourly"),
        @JsonSubTypes.Type(value = RecurrenceRule.PerMinute.class, name = "per-minute"),
        @JsonSubTypes.Type(value = RecurrenceRule.Custom.class, name = "custom")
})
public sealed interface RecurrenceRule {

    <R> R accept(Visitor<R> visitor);

    /**
     * Whether the engine can compute a real deadline for this rule.
     */
    default boolean resolvable() {
        return !(this instanceof Custom);
    }

    interface Visitor<R> {
        R visitDaily(Daily rule);

        R visitWeekly(Weekly rule);

        R visitMonthlyByDay(MonthlyByDay rule);

        R visitMonthlySpecificDate(MonthlySpecificDate rule);

        R visitInterval(Interval rule);

        R visitHourly(Hourly rule);

        R visitPerMinute(PerMinute rule);

        R visitCustom(Custom rule);
    }

    record Daily(String time) implements RecurrenceRule {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDaily(this);
        }
    }

    record Weekly(Integer dayOfWeek, String time) implements RecurrenceRule {
        public Weekly {
            if (dayOfWeek == null) {
                dayOfWeek = 0;
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWeekly(this);
        }
    }

    record MonthlyByDay(Integer dayOfMonth, String time) implements RecurrenceRule {
        public MonthlyByDay {
            if (dayOfMonth == null) {
                dayOfMonth = 1;
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMonthlyByDay(this);
        }
    }

    record MonthlySpecificDate(Integer month, Integer day, String time) implements RecurrenceRule {
        public MonthlySpecificDate {
            if (month == null) {
                month = 1;
            }
            if (day == null) {
                day = 1;
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMonthlySpecificDate(this);
        }
    }

    record Interval(Integer days, String time) implements RecurrenceRule {
        public Interval {
            if (days == null) {
                days = 1;
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInterval(this);
        }
    }

    record Hourly(Integer hours) implements RecurrenceRule {
        public Hourly {
            if (hours == null) {
                hours = 1;
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitHourly(this);
        }
    }

    record PerMinute(Integer minutes) implements RecurrenceRule {
        public PerMinute {
            if (minutes == null) {
                minutes = 1;
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPerMinute(this);
        }
    }

    record Custom(String cronExpression) implements RecurrenceRule {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCustom(this);
        }
    }
}
