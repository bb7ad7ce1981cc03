package com.example.reminder.shared.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * When the notification for a deadline is sent.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ReminderRule.Relative.class, name = "relative"),
        @JsonSubTypes.Type(value = ReminderRule.Absolute.class, name = "absolute")
})
public sealed interface ReminderRule {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitRelative(Relative rule);

        R visitAbsolute(Absolute rule);
    }

    /**
     * {@code daysBefore} whole local days before the deadline, at {@code time} (default 09:00).
     */
    record Relative(Integer daysBefore, String time) implements ReminderRule {
        public Relative {
            if (daysBefore == null) {
                daysBefore = 1;
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRelative(this);
        }
    }

    /**
     * A fixed instant, independent of the deadline.
     */
    record Absolute(Instant dateTime) implements ReminderRule {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAbsolute(this);
        }
    }
}
