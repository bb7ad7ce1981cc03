package com.example.reminder.shared.service.cache;

import com.example.reminder.shared.model.ScheduleDefinition;

import java.util.List;

/**
 * Source of truth for schedule definitions.
 */
public interface SourceStore {

    /**
     * @return every schedule with status {@code ACTIVE}
     */
    List<ScheduleDefinition> listActive();
}
