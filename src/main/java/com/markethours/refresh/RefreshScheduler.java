package com.markethours.refresh;

import com.markethours.calendar.MarketCalendarProperties;
import com.markethours.domain.enums.RefreshTrigger;
import com.markethours.domain.enums.SchedulerState;
import com.markethours.domain.model.RefreshRecord;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

/**
 * Triggers a refresh cycle once a day at the configured UTC hour, plus once on startup.
 *
 * <p>The daily run is a {@link CronTrigger} in UTC, so the schedule does not drift with
 * cycle duration. A scheduled cycle that finds another cycle in progress is skipped. A
 * cycle that throws is logged and the trigger keeps firing.
 *
 * <p>{@link #triggerNow()} runs a cycle on the caller's thread, queued behind any cycle in
 * progress, and leaves the daily schedule untouched. The reported state is RUNNING while
 * any cycle, scheduled or manual, is still in flight.
 */
@Component
public class RefreshScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

    private final RefreshOrchestrator refreshOrchestrator;
    private final TaskScheduler taskScheduler;
    private final MarketCalendarProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger cyclesInFlight = new AtomicInteger();

    private volatile ScheduledFuture<?> nextRun;
    private volatile Instant nextRunAt;

    public RefreshScheduler(
            RefreshOrchestrator refreshOrchestrator,
            @Qualifier("calendarRefreshScheduler") TaskScheduler taskScheduler,
            MarketCalendarProperties properties,
            Clock clock) {
        this.refreshOrchestrator = refreshOrchestrator;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void start() {
        MarketCalendarProperties.Refresh refresh = properties.getRefresh();
        if (!refresh.isEnabled()) {
            log.info("Calendar refresh disabled, serving the stored calendar only");
            return;
        }
        int hour = refresh.getScheduleHour();
        if (hour < 0 || hour > 23) {
            throw new IllegalStateException("market-calendar.refresh.schedule-hour must be 0-23, was " + hour);
        }
        if (running.compareAndSet(false, true)) {
            if (refresh.isRunOnStartup()) {
                taskScheduler.schedule(() -> runCycle(RefreshTrigger.STARTUP), clock.instant());
            }
            nextRun = taskScheduler.schedule(this::runScheduledCycle, new CronTrigger(dailyCron(), ZoneOffset.UTC));
            nextRunAt = nextTriggerAfter(clock.instant());
            log.info("RefreshScheduler started, daily refresh at {}:00 UTC, next run at {}", hour, nextRunAt);
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            ScheduledFuture<?> future = nextRun;
            if (future != null) {
                future.cancel(false);
            }
            nextRunAt = null;
            log.info("RefreshScheduler stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Start last, after the store has published its snapshot and the web layer is up
        return DEFAULT_PHASE;
    }

    /** Runs a manual cycle now, waiting behind any cycle in progress. */
    public RefreshRecord triggerNow() {
        log.info("Manual refresh requested");
        cyclesInFlight.incrementAndGet();
        try {
            return refreshOrchestrator.runRefreshCycle(RefreshTrigger.MANUAL);
        } finally {
            cyclesInFlight.decrementAndGet();
        }
    }

    public SchedulerState getState() {
        if (!running.get()) {
            return SchedulerState.STOPPED;
        }
        return cyclesInFlight.get() > 0 ? SchedulerState.RUNNING : SchedulerState.IDLE;
    }

    public Optional<Instant> getNextRunAt() {
        return Optional.ofNullable(nextRunAt);
    }

    /** First instant strictly after {@code now} at which the daily cron fires. */
    public Instant nextTriggerAfter(Instant now) {
        ZonedDateTime next = CronExpression.parse(dailyCron()).next(now.atZone(ZoneOffset.UTC));
        return next.toInstant();
    }

    private String dailyCron() {
        return "0 0 " + properties.getRefresh().getScheduleHour() + " * * *";
    }

    private void runScheduledCycle() {
        try {
            runCycle(RefreshTrigger.SCHEDULED);
        } finally {
            if (running.get()) {
                nextRunAt = nextTriggerAfter(clock.instant());
                log.debug("Next calendar refresh at {}", nextRunAt);
            }
        }
    }

    private void runCycle(RefreshTrigger trigger) {
        if (!running.get()) {
            return;
        }
        cyclesInFlight.incrementAndGet();
        try {
            if (refreshOrchestrator.tryRunRefreshCycle(trigger).isEmpty()) {
                log.info("{} refresh skipped, another cycle is running", trigger);
            }
        } catch (RuntimeException e) {
            log.error("{} refresh cycle threw, scheduler keeps running", trigger, e);
        } finally {
            cyclesInFlight.decrementAndGet();
        }
    }
}
