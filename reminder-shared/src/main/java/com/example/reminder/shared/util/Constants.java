package com.example.reminder.shared.util;

public final class Constants {

    private Constants() {}

    public static final class RedisKeys {
        private RedisKeys() {}
        public static final String SCHEDULE_CACHE = "schedule-cache:upcoming-reminders";
        public static final String SENT_MARKER_PREFIX = "sent-reminder:";
        public static final String SENT_MARKERS_BY_TIME = "sent-reminders-by-time";
    }

    public static final class LockNames {
        private LockNames() {}
        public static final String SEND_DUE_REMINDERS = "sendDueReminders";
    }

    public enum ScheduleStatus {
        ACTIVE,
        INACTIVE
    }

    public enum StoreType {
        MEMORY,
        REDIS
    }
}
