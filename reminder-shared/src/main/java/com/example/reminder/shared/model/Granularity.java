package com.example.reminder.shared.model;

import java.time.format.DateTimeFormatter;

/**
 * Width of the idempotency bucket. Buckets are cut in UTC.
 */
public enum Granularity {
    DAY(DateTimeFormatter.ofPattern("yyyy-MM-dd")),
    HOUR(DateTimeFormatter.ofPattern("yyyy-MM-dd_HH")),
    MINUTE(DateTimeFormatter.ofPattern("yyyy-MM-dd_HH:mm"));

    private static final RecurrenceRule.Visitor<Granularity> BY_RULE = new RecurrenceRule.Visitor<>() {
        @Override
        public Granularity visitDaily(RecurrenceRule.Daily rule) {
            return DAY;
        }

        @Override
        public Granularity visitWeekly(RecurrenceRule.Weekly rule) {
            return DAY;
        }

        @Override
        public Granularity visitMonthlyByDay(RecurrenceRule.MonthlyByDay rule) {
            return DAY;
        }

        @Override
        public Granularity visitMonthlySpecificDate(RecurrenceRule.MonthlySpecificDate rule) {
            return DAY;
        }

        @Override
        public Granularity visitInterval(RecurrenceRule.Interval rule) {
            return DAY;
        }

        @Override
        public Granularity visitHourly(RecurrenceRule.Hourly rule) {
            return HOUR;
        }

        @Override
        public Granularity visitPerMinute(RecurrenceRule.PerMinute rule) {
            return MINUTE;
        }

        @Override
        public Granularity visitCustom(RecurrenceRule.Custom rule) {
            return DAY;
        }
    };

    private final DateTimeFormatter bucketFormat;

    Granularity(DateTimeFormatter bucketFormat) {
        this.bucketFormat = bucketFormat;
    }

    public DateTimeFormatter bucketFormat() {
        return bucketFormat;
    }

    public static Granularity forRule(RecurrenceRule rule) {
        return rule.accept(BY_RULE);
    }
}
