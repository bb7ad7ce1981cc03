package com.example.reminder.shared.service.marker;

import com.example.reminder.shared.aspect.Monitored;
import com.example.reminder.shared.config.AppProperties;
import com.example.reminder.shared.exception.StoreException;
import com.example.reminder.shared.model.Granularity;
import com.example.reminder.shared.model.SentMarker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * At-most-one reminder per schedule per time bucket.
 *
 * <p>Keys look like {@code <scheduleId>_2025-03-14}, {@code <scheduleId>_2025-03-14_09} or
 * {@code <scheduleId>_2025-03-14_09:30} depending on the granularity. Buckets are cut in UTC.
 *
 * <p>Cleanup removes markers older than the configured maximum age (1 hour by default), even
 * for day-granularity markers whose bucket has not ended yet. Once purged, {@link #hasFired}
 * is false again for the rest of that day.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Monitored("marker")
public class IdempotencyTracker {

    private final SentMarkerStore sentMarkerStore;
    private final AppProperties appProperties;

    public String key(String scheduleId, Instant now, Granularity granularity) {
        return scheduleId + "_" + bucket(now, granularity);
    }

    /**
     * A store failure reads as "not fired": a duplicate reminder is preferred over a missed one.
     */
    public boolean hasFired(String key) {
        try {
            return sentMarkerStore.find(key).isPresent();
        } catch (RuntimeException e) {
            log.warn("Could not read sent marker {}, treating it as not sent: {}", key, e.getMessage());
            return false;
        }
    }

    /**
     * Upsert. Calling it twice for the same key overwrites the first marker.
     *
     * @throws StoreException if the marker could not be written
     */
    public SentMarker markFired(String key, Granularity granularity, MarkerMetadata metadata) {
        SentMarker marker = toMarker(key, granularity, metadata);
        try {
            sentMarkerStore.save(marker);
        } catch (StoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreException("Failed to mark " + key + " as sent", e);
        }
        log.debug("Marked {} as sent to {}", key, metadata.getRecipient());
        return marker;
    }

    /**
     * Atomic insert-if-absent. {@code false} means another caller already holds the bucket.
     * A store failure is treated like a successful claim, for the same reason as {@link #hasFired}.
     */
    public boolean tryMarkFired(String key, Granularity granularity, MarkerMetadata metadata) {
        try {
            return sentMarkerStore.saveIfAbsent(toMarker(key, granularity, metadata));
        } catch (RuntimeException e) {
            log.warn("Could not claim sent marker {}, proceeding without a claim: {}", key, e.getMessage());
            return true;
        }
    }

    /**
     * Drops a claim taken by {@link #tryMarkFired} after the send failed, so a later tick can retry.
     */
    public void releaseClaim(String key) {
        try {
            sentMarkerStore.delete(key);
        } catch (RuntimeException e) {
            log.error("Failed to release claim {}; the reminder will not be retried until cleanup removes it.", key, e);
        }
    }

    public int cleanup(Instant now) {
        return cleanup(appProperties.getMarker().getCleanupMaxAge(), now);
    }

    /**
     * Deletes markers sent more than {@code maxAge} before {@code now}, in batches.
     *
     * @return number of markers removed
     */
    public int cleanup(Duration maxAge, Instant now) {
        Instant cutoff = now.minus(maxAge);
        int batchSize = appProperties.getMarker().getCleanupBatchSize();
        int removed = 0;
        try {
            while (true) {
                List<String> keys = sentMarkerStore.findKeysSentBefore(cutoff, batchSize);
                if (keys.isEmpty()) {
                    break;
                }
                removed += sentMarkerStore.deleteAll(keys);
                if (keys.size() < batchSize) {
                    break;
                }
            }
        } catch (RuntimeException e) {
            log.error("Sent marker cleanup stopped after removing {} markers.", removed, e);
        }
        if (removed > 0) {
            log.info("Cleaned up {} sent markers older than {}", removed, cutoff);
        }
        return removed;
    }

    /**
     * Removes today's day-bucket marker so an edited schedule can be reminded again today.
     *
     * @return {@code true} if a marker existed and was removed
     */
    public boolean clearForSchedule(String scheduleId, Instant now) {
        String key = key(scheduleId, now, Granularity.DAY);
        try {
            boolean removed = sentMarkerStore.delete(key);
            if (removed) {
                log.info("Cleared sent marker for schedule {} ({})", scheduleId, key);
            }
            return removed;
        } catch (RuntimeException e) {
            log.error("Failed to clear sent marker {}", key, e);
            return false;
        }
    }

    /**
     * Sent time of today's day-bucket marker for each schedule that has one.
     */
    public Map<String, Instant> sentToday(Collection<String> scheduleIds, Instant now) {
        Map<String, Instant> sent = new LinkedHashMap<>();
        for (String scheduleId : scheduleIds) {
            try {
                sentMarkerStore.find(key(scheduleId, now, Granularity.DAY))
                        .ifPresent(marker -> sent.put(scheduleId, marker.getSentAt()));
            } catch (RuntimeException e) {
                log.warn("Could not read today's marker for schedule {}: {}", scheduleId, e.getMessage());
            }
        }
        return sent;
    }

    private static String bucket(Instant instant, Granularity granularity) {
        return granularity.bucketFormat().format(instant.atOffset(ZoneOffset.UTC));
    }

    private static SentMarker toMarker(String key, Granularity granularity, MarkerMetadata metadata) {
        return SentMarker.builder()
                .key(key)
                .scheduleId(metadata.getScheduleId())
                .bucket(key.substring(metadata.getScheduleId().length() + 1))
                .granularity(granularity)
                .sentAt(metadata.getSentAt())
                .recipient(metadata.getRecipient())
                .scheduleTitle(metadata.getScheduleTitle())
                .messageId(metadata.getMessageId())
                .build();
    }
}
