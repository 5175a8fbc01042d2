package com.example.bugretention.service;

import com.example.bugretention.config.RetentionProperties;
import com.example.bugretention.requests.ApplyRetentionServiceRequest;
import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.TimeZone;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

/**
 * Runs the retention job on a cron schedule. At most one run executes at a time across
 * scheduled and manual triggers; a trigger that finds a run in progress is skipped.
 */
@Service
@Slf4j
public class RetentionScheduler {

    private final RetentionService retentionService;
    private final TaskScheduler taskScheduler;
    private final RetentionProperties properties;
    private final ObjectProvider<RetentionNotifier> notifierProvider;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledFuture<?> task;

    public RetentionScheduler(RetentionService retentionService,
                              TaskScheduler taskScheduler,
                              RetentionProperties properties,
                              ObjectProvider<RetentionNotifier> notifierProvider,
                              Clock clock) {
        this.retentionService = retentionService;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.notifierProvider = notifierProvider;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        RetentionProperties.Scheduler config = properties.getScheduler();
        if (!config.isEnabled()) {
            log.info("Retention scheduler is disabled");
            return;
        }
        if (task != null) {
            log.warn("Retention scheduler already started");
            return;
        }
        task = taskScheduler.schedule(this::runRetentionJob,
                new CronTrigger(config.getCron(), TimeZone.getTimeZone(config.getTimezone())));
        log.info("Retention scheduler started (cron '{}', zone {})", config.getCron(), config.getTimezone());
    }

    @EventListener(ContextClosedEvent.class)
    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.info("Retention scheduler stopped");
        }
    }

    public synchronized boolean isScheduled() {
        return task != null;
    }

    /**
     * Executes one confirmed, non dry-run pass unless another run is active.
     *
     * @return false when skipped because a run was in progress
     */
    public boolean runRetentionJob() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Retention job already running, skipping this execution");
            return false;
        }
        long start = clock.millis();
        RetentionNotifier notifier = notifierProvider.getIfAvailable();
        try {
            RetentionProperties.Scheduler config = properties.getScheduler();
            RetentionResult result = retentionService.applyRetentionPolicies(new ApplyRetentionServiceRequest(
                    null, false, config.getBatchSize(), config.getMaxErrorRate(), config.getDelayMs(), true, null));
            long duration = clock.millis() - start;
            log.info("Retention job completed in {}ms: deleted={}, errors={}, aborted={}",
                    duration, result.totalDeleted(), result.errors().size(), result.aborted());
            if (notifier != null) {
                notifier.notifyCompletion(result, duration);
            }
        } catch (RuntimeException ex) {
            log.error("Retention job failed: {}", ex.getMessage(), ex);
            if (notifier != null) {
                notifier.notifyError(ex);
            }
        } finally {
            running.set(false);
        }
        return true;
    }

    /**
     * Runs the job now on the caller's thread.
     *
     * @return false if a run was already in progress, true once a fresh run completed
     */
    public boolean triggerManual() {
        log.info("Manual retention trigger");
        return runRetentionJob();
    }

    public boolean isJobRunning() {
        return running.get();
    }

    /**
     * @return next cron fire time, or null when the scheduler is disabled
     */
    public ZonedDateTime getNextRunTime() {
        RetentionProperties.Scheduler config = properties.getScheduler();
        if (!config.isEnabled()) {
            return null;
        }
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(ZoneId.of(config.getTimezone())));
        return CronExpression.parse(config.getCron()).next(now);
    }
}
