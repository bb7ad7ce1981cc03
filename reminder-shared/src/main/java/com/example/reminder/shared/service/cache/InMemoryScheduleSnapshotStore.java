package com.example.reminder.shared.service.cache;

import com.example.reminder.shared.model.ScheduleCacheSnapshot;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

@Component
@ConditionalOnProperty(prefix = "reminder.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryScheduleSnapshotStore implements ScheduleSnapshotStore {

    private final AtomicReference<ScheduleCacheSnapshot> current = new AtomicReference<>();

    @Override
    public Optional<ScheduleCacheSnapshot> load() {
        return Optional.ofNullable(current.get());
    }

    @Override
    public void replace(ScheduleCacheSnapshot snapshot) {
        current.set(snapshot);
    }
}
