package com.example.reminder.cron.service;

import com.example.reminder.cron.dto.CronRunSummary;
import com.example.reminder.shared.aspect.Monitored;
import com.example.reminder.shared.util.Constants.LockNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * In-process trigger for deployments without an external cron caller. Only one instance
 * runs a tick at a time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "reminder.cron", name = "internal-trigger-enabled", havingValue = "true")
public class ReminderSchedulingService {

    private final CronOrchestratorService cronOrchestratorService;
    private final Clock clock;

    @Monitored("scheduler")
    @Scheduled(cron = "${reminder.cron.schedule:0 * * * * *}")
    @SchedulerLock(name = LockNames.SEND_DUE_REMINDERS, lockAtLeastFor = "PT30S", lockAtMostFor = "PT59S")
    public void sendDueReminders() {
        log.debug("Internal trigger: starting reminder run");
        CronRunSummary summary = cronOrchestratorService.runOnce(clock.instant()).block();
        if (summary != null && summary.isNeedsSync()) {
            log.warn("Internal trigger: schedule cache is empty, sync it via POST /api/schedules/sync-cache");
        }
    }
}
