package com.example.reminder.cron.service;

import com.example.reminder.cron.dto.CronRunDetail;
import com.example.reminder.cron.dto.CronRunSummary;
import com.example.reminder.cron.dto.DetailStatus;
import com.example.reminder.cron.dto.ReminderMessage;
import com.example.reminder.shared.config.AppProperties;
import com.example.reminder.shared.config.MonitoringConfig;
import com.example.reminder.shared.exception.ComputationException;
import com.example.reminder.shared.exception.DispatchException;
import com.example.reminder.shared.exception.StoreException;
import com.example.reminder.shared.model.CachedSchedule;
import com.example.reminder.shared.model.Granularity;
import com.example.reminder.shared.notifier.NotificationResult;
import com.example.reminder.shared.notifier.Notifier;
import com.example.reminder.shared.service.cache.ScheduleCacheService;
import com.example.reminder.shared.service.marker.IdempotencyTracker;
import com.example.reminder.shared.service.marker.MarkerMetadata;
import com.example.reminder.shared.service.schedule.DispatchWindowChecker;
import com.example.reminder.shared.service.schedule.RecurrenceCalculator;
import com.example.reminder.shared.service.schedule.ReminderScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static com.example.reminder.shared.config.MonitoringConfig.CRON_RUNS;
import static com.example.reminder.shared.config.MonitoringConfig.MARKERS_CLEANED;
import static com.example.reminder.shared.config.MonitoringConfig.NOTIFICATIONS;

/**
 * One reminder tick.
 *
 * <ol>
 *   <li>Read the schedule snapshot. Empty means "needs sync": clean up markers and stop.
 *   <li>Pre-filter schedules whose reminder instant lies within the pre-filter window of now.
 *   <li>For each candidate, in parallel: recompute, check the dispatch window, check the
 *       sent marker, send, then mark the bucket as sent.
 *   <li>Clean up old markers when the pass had candidates and no errors.
 *   <li>Write the audit entry and return the summary.
 * </ol>
 *
 * Failures for one schedule are recorded in its detail and never stop the others.
 */
@Service
@Slf4j
public class CronOrchestratorService {

    static final String NEEDS_SYNC_MESSAGE = "No schedules in cache - please sync";
    static final String NOTHING_IN_WINDOW_MESSAGE = "No reminders in window";

    private final ScheduleCacheService scheduleCacheService;
    private final RecurrenceCalculator recurrenceCalculator;
    private final ReminderScheduler reminderScheduler;
    private final DispatchWindowChecker dispatchWindowChecker;
    private final IdempotencyTracker idempotencyTracker;
    private final Notifier notifier;
    private final ReminderMessageFactory messageFactory;
    private final CronAuditService cronAuditService;
    private final MonitoringConfig.ReminderMetricsCollector metricsCollector;
    private final AppProperties appProperties;
    private final Scheduler dispatchScheduler;

    public CronOrchestratorService(ScheduleCacheService scheduleCacheService,
                                   RecurrenceCalculator recurrenceCalculator,
                                   ReminderScheduler reminderScheduler,
                                   DispatchWindowChecker dispatchWindowChecker,
                                   IdempotencyTracker idempotencyTracker,
                                   Notifier notifier,
                                   ReminderMessageFactory messageFactory,
                                   CronAuditService cronAuditService,
                                   MonitoringConfig.ReminderMetricsCollector metricsCollector,
                                   AppProperties appProperties,
                                   @Qualifier("reminderDispatchScheduler") Scheduler dispatchScheduler) {
        this.scheduleCacheService = scheduleCacheService;
        this.recurrenceCalculator = recurrenceCalculator;
        this.reminderScheduler = reminderScheduler;
        this.dispatchWindowChecker = dispatchWindowChecker;
        this.idempotencyTracker = idempotencyTracker;
        this.notifier = notifier;
        this.messageFactory = messageFactory;
        this.cronAuditService = cronAuditService;
        this.metricsCollector = metricsCollector;
        this.appProperties = appProperties;
        this.dispatchScheduler = dispatchScheduler;
    }

    public Mono<CronRunSummary> runOnce(Instant now) {
        long startTime = System.currentTimeMillis();
        return Mono.fromCallable(scheduleCacheService::read)
                .subscribeOn(dispatchScheduler)
                .flatMap(cached -> cached.isEmpty()
                        ? needsSync(now)
                        : process(cached, now))
                .map(summary -> finish(summary, now, startTime))
                .subscribeOn(dispatchScheduler);
    }

    private Mono<CronRunSummary> needsSync(Instant now) {
        log.info("No schedules in cache, a cache sync is needed");
        return Mono.fromCallable(() -> CronRunSummary.builder()
                .cacheHit(false)
                .needsSync(true)
                .cleanedUp(cleanup(now))
                .message(NEEDS_SYNC_MESSAGE)
                .build());
    }

    private Mono<CronRunSummary> process(List<CachedSchedule> cached, Instant now) {
        List<CronRunDetail> prefilterErrors = new ArrayList<>();
        List<CachedSchedule> candidates = prefilter(cached, now, prefilterErrors);
        log.info("Loaded {} schedules from cache, {} in the pre-filter window", cached.size(), candidates.size());

        if (candidates.isEmpty()) {
            return Mono.fromCallable(() -> {
                CronRunSummary summary = summarize(prefilterErrors);
                summary.setCacheHit(true);
                summary.setCleanedUp(cleanup(now));
                summary.setMessage(NOTHING_IN_WINDOW_MESSAGE);
                return summary;
            });
        }

        int concurrency = appProperties.getCron().getDispatchConcurrency();
        return Flux.fromIterable(candidates)
                .flatMap(schedule -> evaluate(schedule, now), concurrency)
                .collectList()
                .map(details -> {
                    List<CronRunDetail> all = new ArrayList<>(prefilterErrors);
                    all.addAll(details);
                    CronRunSummary summary = summarize(all);
                    summary.setCacheHit(true);
                    summary.setChecked(candidates.size());
                    if (summary.getErrors() == 0 && summary.getChecked() > 0) {
                        summary.setCleanedUp(cleanup(now));
                    } else if (summary.getErrors() > 0) {
                        log.info("Skipping marker cleanup, {} errors in this run", summary.getErrors());
                    }
                    return summary;
                });
    }

    /**
     * Coarse pass: keeps schedules whose reminder instant is within the pre-filter window of
     * {@code now}. Rules the engine cannot resolve are never candidates; unreadable rule data
     * is reported as an error detail.
     */
    List<CachedSchedule> prefilter(List<CachedSchedule> cached, Instant now, List<CronRunDetail> errors) {
        Duration window = appProperties.getCron().getPrefilterWindow();
        Instant windowStart = now.minus(window);
        Instant windowEnd = now.plus(window);
        List<CachedSchedule> candidates = new ArrayList<>();

        for (CachedSchedule schedule : cached) {
            if (schedule.getRuleError() != null) {
                log.warn("Schedule {} skipped: {}", schedule.getId(), schedule.getRuleError());
                errors.add(CronRunDetail.error(schedule.getId(), schedule.getTitle(), schedule.getRuleError()));
                continue;
            }
            if (schedule.getRecurrence() != null && !schedule.getRecurrence().resolvable()) {
                log.debug("Schedule {} uses a custom recurrence, not evaluated", schedule.getId());
                continue;
            }
            try {
                Instant reminderAt = reminderInstant(schedule, now);
                if (!reminderAt.isBefore(windowStart) && !reminderAt.isAfter(windowEnd)) {
                    candidates.add(schedule);
                }
            } catch (ComputationException e) {
                log.warn("Could not compute reminder for schedule {}: {}", schedule.getId(), e.getMessage());
                errors.add(CronRunDetail.error(schedule.getId(), schedule.getTitle(), e.getMessage()));
            }
        }
        return candidates;
    }

    Mono<CronRunDetail> evaluate(CachedSchedule schedule, Instant now) {
        return Mono.defer(() -> {
                    Instant deadline = nextDeadline(schedule, now);
                    Instant reminderAt = reminderScheduler.reminderInstant(schedule.getReminder(), deadline);

                    if (!dispatchWindowChecker.shouldFireNow(reminderAt, now)) {
                        long diffMinutes = Duration.between(reminderAt, now).toMinutes();
                        log.debug("Schedule {} not in window (reminder {}, diff {}m)", schedule.getId(), reminderAt, diffMinutes);
                        return Mono.just(CronRunDetail.skipped(schedule.getId(), schedule.getTitle(),
                                "Not in window. Reminder: " + reminderAt + ", Now: " + now + ", Diff: " + diffMinutes + "m"));
                    }

                    Granularity granularity = Granularity.forRule(schedule.getRecurrence());
                    String key = idempotencyTracker.key(schedule.getId(), now, granularity);
                    boolean claimed = appProperties.getMarker().isClaimBeforeSend();
                    boolean alreadySent = claimed
                            ? !idempotencyTracker.tryMarkFired(key, granularity, metadata(schedule, now, null))
                            : idempotencyTracker.hasFired(key);
                    if (alreadySent) {
                        log.debug("Schedule {} already sent ({})", schedule.getId(), key);
                        return Mono.just(CronRunDetail.skipped(schedule.getId(), schedule.getTitle(),
                                "Already sent (" + granularity.name().toLowerCase() + " granularity)"));
                    }
                    return dispatch(schedule, deadline, granularity, key, now, claimed);
                })
                .subscribeOn(dispatchScheduler)
                .onErrorResume(e -> {
                    log.warn("Schedule {} failed: {}", schedule.getId(), e.getMessage());
                    return Mono.just(CronRunDetail.error(schedule.getId(), schedule.getTitle(), e.getMessage()));
                });
    }

    private Mono<CronRunDetail> dispatch(CachedSchedule schedule, Instant deadline, Granularity granularity,
                                         String key, Instant now, boolean claimed) {
        String recipient = schedule.getAssigneeEmail();
        Duration timeout = appProperties.getCron().getDispatchTimeout();
        return Mono.fromCallable(() -> {
                    ReminderMessage message = messageFactory.create(schedule, deadline);
                    return notifier.send(recipient, message.subject(), message.body());
                })
                .subscribeOn(dispatchScheduler)
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof DispatchException), e -> e instanceof TimeoutException
                        ? new DispatchException("Notification timed out after " + timeout.toMillis() + "ms", recipient, e)
                        : new DispatchException(e.getMessage(), recipient, e))
                .flatMap(result -> {
                    if (!result.isSuccess()) {
                        return Mono.error(new DispatchException(result.getError(), recipient));
                    }
                    recordSent(key, granularity, metadata(schedule, now, result));
                    log.info("Reminder for schedule {} sent to {} (Message ID: {})", schedule.getId(), recipient, result.getMessageId());
                    return Mono.just(CronRunDetail.sent(schedule.getId(), schedule.getTitle(),
                            "Sent to " + recipient + ". Deadline: " + deadline + ". Message ID: " + result.getMessageId()));
                })
                .onErrorResume(DispatchException.class, e -> {
                    if (claimed) {
                        idempotencyTracker.releaseClaim(key);
                    }
                    log.warn("Reminder for schedule {} to {} failed: {}", schedule.getId(), recipient, e.getMessage());
                    return Mono.just(CronRunDetail.error(schedule.getId(), schedule.getTitle(), e.getMessage()));
                });
    }

    /**
     * The mail has gone out at this point, so a failed marker write is logged and the
     * reminder still counts as sent.
     */
    private void recordSent(String key, Granularity granularity, MarkerMetadata metadata) {
        try {
            idempotencyTracker.markFired(key, granularity, metadata);
        } catch (StoreException e) {
            log.error("Reminder sent but marker {} could not be written; it may be sent again next tick", key, e);
        }
    }

    private Instant nextDeadline(CachedSchedule schedule, Instant now) {
        try {
            return recurrenceCalculator.nextDeadline(schedule.getRecurrence(), now,
                    appProperties.getCron().getDefaultCreationAnchor());
        } catch (ComputationException e) {
            throw e.withScheduleId(schedule.getId());
        }
    }

    private Instant reminderInstant(CachedSchedule schedule, Instant now) {
        Instant deadline = nextDeadline(schedule, now);
        try {
            return reminderScheduler.reminderInstant(schedule.getReminder(), deadline);
        } catch (ComputationException e) {
            throw e.withScheduleId(schedule.getId());
        }
    }

    private int cleanup(Instant now) {
        int cleaned = idempotencyTracker.cleanup(now);
        metricsCollector.incrementCounter(MARKERS_CLEANED, cleaned);
        return cleaned;
    }

    private CronRunSummary finish(CronRunSummary summary, Instant now, long startTime) {
        summary.setTimestamp(now);
        summary.setDurationMs(System.currentTimeMillis() - startTime);
        summary.setIntervalSinceLastRunMs(cronAuditService.record(now.plusMillis(summary.getDurationMs()), summary));

        metricsCollector.incrementCounter(CRON_RUNS, "outcome", summary.isNeedsSync() ? "needs_sync" : "processed");
        metricsCollector.incrementCounter(NOTIFICATIONS, summary.getSent(), "status", "sent");
        metricsCollector.incrementCounter(NOTIFICATIONS, summary.getSkipped(), "status", "skipped");
        metricsCollector.incrementCounter(NOTIFICATIONS, summary.getErrors(), "status", "error");
        metricsCollector.recordTimer("reminder.cron.duration", summary.getDurationMs());

        log.info("Cron run finished in {}ms: checked={}, sent={}, skipped={}, errors={}, cleanedUp={}",
                summary.getDurationMs(), summary.getChecked(), summary.getSent(), summary.getSkipped(),
                summary.getErrors(), summary.getCleanedUp());
        return summary;
    }

    private static CronRunSummary summarize(List<CronRunDetail> details) {
        CronRunSummary summary = CronRunSummary.builder().details(details).build();
        for (CronRunDetail detail : details) {
            if (detail.getStatus() == DetailStatus.SENT) {
                summary.setSent(summary.getSent() + 1);
            } else if (detail.getStatus() == DetailStatus.SKIPPED) {
                summary.setSkipped(summary.getSkipped() + 1);
            } else {
                summary.setErrors(summary.getErrors() + 1);
            }
        }
        return summary;
    }

    private static MarkerMetadata metadata(CachedSchedule schedule, Instant now, NotificationResult result) {
        return MarkerMetadata.builder()
                .scheduleId(schedule.getId())
                .recipient(schedule.getAssigneeEmail())
                .scheduleTitle(schedule.getTitle())
                .messageId(result != null ? result.getMessageId() : null)
                .sentAt(now)
                .build();
    }
}
