package com.example.reminder.shared.service.schedule;

import com.example.reminder.shared.exception.ComputationException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between absolute instants and wall-clock values at one fixed offset.
 */
public final class WallClock {

    public static final LocalTime END_OF_DAY = LocalTime.of(23, 59);

    private static final Pattern HH_MM = Pattern.compile("^(\\d{1,2}):(\\d{2})$");

    private final ZoneOffset offset;

    public WallClock(ZoneOffset offset) {
        this.offset = offset;
    }

    public LocalDateTime local(Instant instant) {
        return LocalDateTime.ofInstant(instant, offset);
    }

    public LocalDate localDate(Instant instant) {
        return local(instant).toLocalDate();
    }

    public Instant at(LocalDate date, LocalTime time) {
        return date.atTime(time).toInstant(offset);
    }

    public Instant at(LocalDateTime dateTime) {
        return dateTime.toInstant(offset);
    }

    /**
     * Parses {@code HH:mm}; {@code null} or blank yields {@code fallback}.
     */
    public static LocalTime parseTime(String value, LocalTime fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        Matcher matcher = HH_MM.matcher(value.trim());
        if (!matcher.matches()) {
            throw new ComputationException("Invalid time '" + value + "', expected HH:mm");
        }
        int hours = Integer.parseInt(matcher.group(1));
        int minutes = Integer.parseInt(matcher.group(2));
        if (hours > 23 || minutes > 59) {
            throw new ComputationException("Time out of range: '" + value + "'");
        }
        return LocalTime.of(hours, minutes);
    }
}
