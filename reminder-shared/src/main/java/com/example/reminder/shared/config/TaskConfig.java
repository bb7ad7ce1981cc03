package com.example.reminder.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class TaskConfig {

    /**
     * Customizes the thread pool for @Scheduled methods.
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("reminder-scheduler-");
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Runs per-schedule evaluation and the blocking notifier calls of one tick.
     * Bounded so a burst of slow sends cannot exhaust threads.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler reminderDispatchScheduler(AppProperties appProperties) {
        int threadCap = Math.max(appProperties.getCron().getDispatchConcurrency(), 1) * 2;
        return Schedulers.newBoundedElastic(threadCap, 10_000, "reminder-dispatch-");
    }
}
