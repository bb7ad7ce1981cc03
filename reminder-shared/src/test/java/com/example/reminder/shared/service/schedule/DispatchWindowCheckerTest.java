package com.example.reminder.shared.service.schedule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DispatchWindowCheckerTest {

    private static final Instant REMINDER = Instant.parse("2025-03-10T01:00:00Z");

    private final DispatchWindowChecker checker = DispatchWindowChecker.withDefaults();

    @Test
    @DisplayName("opens two minutes early, inclusive")
    void lowerBound() {
        assertThat(checker.shouldFireNow(REMINDER, REMINDER.minus(Duration.ofMinutes(2)))).isTrue();
        assertThat(checker.shouldFireNow(REMINDER, REMINDER.minus(Duration.ofMinutes(2)).minusSeconds(1))).isFalse();
    }

    @Test
    @DisplayName("closes three minutes late, inclusive")
    void upperBound() {
        assertThat(checker.shouldFireNow(REMINDER, REMINDER.plus(Duration.ofMinutes(3)))).isTrue();
        assertThat(checker.shouldFireNow(REMINDER, REMINDER.plus(Duration.ofMinutes(3)).plusSeconds(1))).isFalse();
    }

    @Test
    void exactInstantFires() {
        assertThat(checker.shouldFireNow(REMINDER, REMINDER)).isTrue();
    }

    @Test
    void customWidthIsHonoured() {
        DispatchWindowChecker narrow = new DispatchWindowChecker(Duration.ZERO, Duration.ofSeconds(30));
        assertThat(narrow.shouldFireNow(REMINDER, REMINDER.minusSeconds(1))).isFalse();
        assertThat(narrow.shouldFireNow(REMINDER, REMINDER.plusSeconds(30))).isTrue();
    }
}
