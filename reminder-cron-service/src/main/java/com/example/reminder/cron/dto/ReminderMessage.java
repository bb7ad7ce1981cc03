package com.example.reminder.cron.dto;

public record ReminderMessage(String subject, String body) {
}
