package com.example.reminder.shared.service.marker;

import com.example.reminder.shared.model.SentMarker;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Keyed storage for sent markers. Implementations wrap their own failures in
 * {@link com.example.reminder.shared.exception.StoreException}.
 */
public interface SentMarkerStore {

    Optional<SentMarker> find(String key);

    /**
     * Insert or overwrite.
     */
    void save(SentMarker marker);

    /**
     * Atomic insert-if-absent.
     *
     * @return {@code false} if a marker with the same key already existed
     */
    boolean saveIfAbsent(SentMarker marker);

    boolean delete(String key);

    /**
     * Keys of markers whose {@code sentAt} is strictly before {@code cutoff}, oldest first.
     */
    List<String> findKeysSentBefore(Instant cutoff, int limit);

    int deleteAll(Collection<String> keys);
}
