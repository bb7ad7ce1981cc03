package com.example.reminder.shared.service.marker;

import com.example.reminder.shared.config.AppProperties;
import com.example.reminder.shared.exception.StoreException;
import com.example.reminder.shared.model.Granularity;
import com.example.reminder.shared.model.SentMarker;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class IdempotencyTrackerTest {

    private static final Instant NOW = Instant.parse("2025-03-10T01:30:15Z");

    private Cache<String, SentMarker> cache;
    private AppProperties appProperties;
    private IdempotencyTracker tracker;

    @BeforeEach
    void setUp() {
        cache = Caffeine.newBuilder().build();
        appProperties = new AppProperties();
        tracker = new IdempotencyTracker(new CaffeineSentMarkerStore(cache), appProperties);
    }

    private static MarkerMetadata metadata(String scheduleId, Instant sentAt) {
        return MarkerMetadata.builder()
                .scheduleId(scheduleId)
                .recipient("juan@example.com")
                .scheduleTitle("Generator test run")
                .messageId("<m1@example.com>")
                .sentAt(sentAt)
                .build();
    }

    @Nested
    @DisplayName("key")
    class Key {

        @Test
        void formatsEachGranularity() {
            assertThat(tracker.key("s1", NOW, Granularity.DAY)).isEqualTo("s1_2025-03-10");
            assertThat(tracker.key("s1", NOW, Granularity.HOUR)).isEqualTo("s1_2025-03-10_01");
            assertThat(tracker.key("s1", NOW, Granularity.MINUTE)).isEqualTo("s1_2025-03-10_01:30");
        }

        @Test
        @DisplayName("buckets are cut in UTC")
        void utcBuckets() {
            // 04:00 on the 10th at +08:00, still the 9th in UTC
            assertThat(tracker.key("s1", Instant.parse("2025-03-09T20:00:00Z"), Granularity.DAY)).isEqualTo("s1_2025-03-09");
        }
    }

    @Test
    @DisplayName("marking a key makes it fired; another bucket stays unfired")
    void roundTrip() {
        String key = tracker.key("s1", NOW, Granularity.DAY);
        tracker.markFired(key, Granularity.DAY, metadata("s1", NOW));

        assertThat(tracker.hasFired(key)).isTrue();
        assertThat(tracker.hasFired(tracker.key("s1", NOW.plus(Duration.ofDays(1)), Granularity.DAY))).isFalse();
        assertThat(tracker.hasFired(tracker.key("s2", NOW, Granularity.DAY))).isFalse();
    }

    @Test
    @DisplayName("marking twice overwrites the marker")
    void upsert() {
        String key = tracker.key("s1", NOW, Granularity.DAY);
        tracker.markFired(key, Granularity.DAY, metadata("s1", NOW));
        SentMarker second = tracker.markFired(key, Granularity.DAY, metadata("s1", NOW.plusSeconds(60)));

        assertThat(cache.getIfPresent(key)).isEqualTo(second);
        assertThat(second.getBucket()).isEqualTo("2025-03-10");
        assertThat(cache.estimatedSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("claims are exclusive until released")
    void claims() {
        String key = tracker.key("s1", NOW, Granularity.MINUTE);

        assertThat(tracker.tryMarkFired(key, Granularity.MINUTE, metadata("s1", NOW))).isTrue();
        assertThat(tracker.tryMarkFired(key, Granularity.MINUTE, metadata("s1", NOW))).isFalse();

        tracker.releaseClaim(key);
        assertThat(tracker.hasFired(key)).isFalse();
    }

    @Nested
    @DisplayName("cleanup")
    class Cleanup {

        @Test
        @DisplayName("purges a day marker after an hour even though the day has not ended")
        void purgesDayMarkerEarly() {
            String key = tracker.key("s1", NOW, Granularity.DAY);
            tracker.markFired(key, Granularity.DAY, metadata("s1", NOW));

            int removed = tracker.cleanup(Duration.ofHours(1), NOW.plus(Duration.ofMinutes(90)));

            assertThat(removed).isEqualTo(1);
            assertThat(tracker.hasFired(key)).isFalse();
        }

        @Test
        void keepsRecentMarkers() {
            String key = tracker.key("s1", NOW, Granularity.DAY);
            tracker.markFired(key, Granularity.DAY, metadata("s1", NOW));

            assertThat(tracker.cleanup(Duration.ofHours(1), NOW.plus(Duration.ofMinutes(30)))).isZero();
            assertThat(tracker.hasFired(key)).isTrue();
        }

        @Test
        @DisplayName("works through more markers than one batch")
        void batches() {
            appProperties.getMarker().setCleanupBatchSize(2);
            for (int i = 0; i < 5; i++) {
                String id = "s" + i;
                tracker.markFired(tracker.key(id, NOW, Granularity.DAY), Granularity.DAY, metadata(id, NOW.minusSeconds(i)));
            }

            assertThat(tracker.cleanup(NOW.plus(Duration.ofHours(2)))).isEqualTo(5);
            assertThat(cache.estimatedSize()).isZero();
        }
    }

    @Test
    @DisplayName("clearing a schedule removes only today's day marker")
    void clearForSchedule() {
        String today = tracker.key("s1", NOW, Granularity.DAY);
        String yesterday = tracker.key("s1", NOW.minus(Duration.ofDays(1)), Granularity.DAY);
        tracker.markFired(today, Granularity.DAY, metadata("s1", NOW));
        tracker.markFired(yesterday, Granularity.DAY, metadata("s1", NOW.minus(Duration.ofDays(1))));

        assertThat(tracker.clearForSchedule("s1", NOW)).isTrue();
        assertThat(tracker.clearForSchedule("s1", NOW)).isFalse();
        assertThat(tracker.hasFired(today)).isFalse();
        assertThat(tracker.hasFired(yesterday)).isTrue();
    }

    @Test
    void sentTodayListsOnlySchedulesWithTodaysMarker() {
        tracker.markFired(tracker.key("s1", NOW, Granularity.DAY), Granularity.DAY, metadata("s1", NOW));

        Map<String, Instant> sent = tracker.sentToday(List.of("s1", "s2"), NOW);

        assertThat(sent).containsOnlyKeys("s1");
        assertThat(sent.get("s1")).isEqualTo(NOW);
    }

    @Nested
    @DisplayName("when the store fails")
    class StoreFailure {

        private final SentMarkerStore failingStore = mock(SentMarkerStore.class);
        private final IdempotencyTracker failingTracker = new IdempotencyTracker(failingStore, new AppProperties());

        @Test
        @DisplayName("a failed read counts as not fired")
        void readFailure() {
            when(failingStore.find(anyString())).thenThrow(new StoreException("down", new RuntimeException()));

            assertThat(failingTracker.hasFired("s1_2025-03-10")).isFalse();
        }

        @Test
        void writeFailurePropagates() {
            doThrow(new StoreException("down", new RuntimeException())).when(failingStore).save(any());

            assertThatThrownBy(() -> failingTracker.markFired("s1_2025-03-10", Granularity.DAY, metadata("s1", NOW)))
                    .isInstanceOf(StoreException.class);
        }

        @Test
        void cleanupStopsAndReportsWhatWasRemoved() {
            when(failingStore.findKeysSentBefore(any(), anyInt())).thenThrow(new StoreException("down", new RuntimeException()));

            assertThat(failingTracker.cleanup(NOW)).isZero();
        }
    }
}
