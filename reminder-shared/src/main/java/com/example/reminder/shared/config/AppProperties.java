package com.example.reminder.shared.config;

import com.example.reminder.shared.util.Constants.StoreType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

@Data
@Validated
public class AppProperties {

    /**
     * Fixed offset used for every wall-clock computation. Never the host time zone.
     */
    @NotNull
    private ZoneOffset zoneOffset = ZoneOffset.ofHours(8);

    private final Window window = new Window();
    private final Cron cron = new Cron();
    private final Marker marker = new Marker();
    private final Store store = new Store();
    private final Notifier notifier = new Notifier();

    @Data
    public static class Window {
        @NotNull
        private Duration before = Duration.ofMinutes(2);
        @NotNull
        private Duration after = Duration.ofMinutes(3);
    }

    @Data
    public static class Cron {
        private String secret;
        @NotNull
        private Duration prefilterWindow = Duration.ofMinutes(3);
        @NotNull
        private Duration dispatchTimeout = Duration.ofSeconds(10);
        @Positive
        private int dispatchConcurrency = 8;
        // The snapshot drops the creation instant; interval rules are anchored here instead.
        // 2024-01-01T00:00 at +08:00.
        @NotNull
        private Instant defaultCreationAnchor = Instant.parse("2023-12-31T16:00:00Z");
        private boolean internalTriggerEnabled = false;
        private String schedule = "0 * * * * *";
    }

    @Data
    public static class Marker {
        @NotNull
        private Duration cleanupMaxAge = Duration.ofHours(1);
        @Positive
        private int cleanupBatchSize = 100;
        private boolean claimBeforeSend = false;
    }

    @Data
    public static class Store {
        @NotNull
        private StoreType type = StoreType.MEMORY;
    }

    @Data
    public static class Notifier {
        private String type = "log";
        private String from = "reminders@localhost";
        private String senderName = "Operation & Maintenance (O&M)";
    }
}
