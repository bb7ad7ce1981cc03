package com.example.reminder.cron.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DetailStatus {
    SENT,
    SKIPPED,
    ERROR;

    @JsonValue
    public String json() {
        return name().toLowerCase();
    }
}
