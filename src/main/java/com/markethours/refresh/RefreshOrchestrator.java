package com.markethours.refresh;

import com.markethours.acquisition.ScheduleSource;
import com.markethours.calendar.ExchangeHours;
import com.markethours.domain.enums.RefreshStatus;
import com.markethours.domain.enums.RefreshTrigger;
import com.markethours.domain.model.RawScheduleRecords;
import com.markethours.domain.model.RefreshRecord;
import com.markethours.domain.model.YearRange;
import com.markethours.event.CalendarRefreshedEvent;
import com.markethours.exception.AcquisitionException;
import com.markethours.exception.BaseException;
import com.markethours.exception.ErrorCode;
import com.markethours.exception.ScheduleParseException;
import com.markethours.exception.ScheduleValidationException;
import com.markethours.store.CalendarStore;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Runs one refresh cycle: acquire the current and next year's schedule, validate it,
 * commit it to the {@link CalendarStore} and append a {@link RefreshRecord}.
 *
 * <p>Failures never escape a cycle. Acquisition, parse, validation and persistence errors
 * all become a FAILURE record and the previously published calendar keeps serving
 * (stale-but-safe). Parse and validation errors are logged at ERROR because they need an
 * operator; acquisition errors are usually transient and logged at WARN.
 *
 * <p>Cycles are serialised by a lock: {@link #runRefreshCycle} waits for a running cycle to
 * finish, {@link #tryRunRefreshCycle} skips instead. Commits are full replaces of the covered
 * year range, so re-running a cycle against an unchanged upstream is a no-op in effect.
 */
@Service
public class RefreshOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RefreshOrchestrator.class);

    private static final int MAX_ERROR_LENGTH = 2000;

    private final ScheduleSource scheduleSource;
    private final ScheduleValidator scheduleValidator;
    private final CalendarStore calendarStore;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();

    public RefreshOrchestrator(
            ScheduleSource scheduleSource,
            ScheduleValidator scheduleValidator,
            CalendarStore calendarStore,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.scheduleSource = scheduleSource;
        this.scheduleValidator = scheduleValidator;
        this.calendarStore = calendarStore;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    /** Runs a cycle, waiting for any cycle already in progress to finish first. */
    public RefreshRecord runRefreshCycle(RefreshTrigger trigger) {
        cycleLock.lock();
        try {
            return executeCycle(trigger);
        } finally {
            cycleLock.unlock();
        }
    }

    /** Runs a cycle unless one is already in progress, in which case nothing happens. */
    public Optional<RefreshRecord> tryRunRefreshCycle(RefreshTrigger trigger) {
        if (!cycleLock.tryLock()) {
            log.info("Refresh cycle already in progress, skipping {} trigger", trigger);
            return Optional.empty();
        }
        try {
            return Optional.of(executeCycle(trigger));
        } finally {
            cycleLock.unlock();
        }
    }

    public boolean isCycleInProgress() {
        return cycleLock.isLocked();
    }

    public Optional<RefreshRecord> getLastRefresh() {
        return calendarStore.lastRefresh();
    }

    public Optional<RefreshRecord> getLastSuccessfulRefresh() {
        return calendarStore.lastSuccessfulRefresh();
    }

    public List<RefreshRecord> getRefreshHistory(int limit) {
        return calendarStore.refreshHistory(limit);
    }

    private RefreshRecord executeCycle(RefreshTrigger trigger) {
        Instant startedAt = clock.instant();
        YearRange yearRange = YearRange.currentAndNext(startedAt.atZone(ExchangeHours.ZONE).getYear());
        log.info("Refresh cycle started: trigger={}, years={}", trigger, yearRange);

        RefreshRecord.RefreshRecordBuilder record =
                RefreshRecord.builder().runAt(startedAt).trigger(trigger).source(scheduleSource.name());

        try {
            RawScheduleRecords raw = scheduleSource.fetchSchedule(yearRange);
            ValidatedSchedule schedule = scheduleValidator.validate(raw, yearRange);
            calendarStore.commit(yearRange, schedule.getHolidays(), schedule.getOverrides(), clock.instant());

            record.status(RefreshStatus.SUCCESS).recordsIngested(schedule.recordCount());
            if (raw.getSource() != null) {
                record.source(raw.getSource());
            }
            log.info(
                    "Refresh cycle succeeded: {} holidays, {} early closes committed for {}",
                    schedule.getHolidays().size(),
                    schedule.getOverrides().size(),
                    yearRange);
        } catch (AcquisitionException e) {
            log.warn("Refresh cycle failed, schedule source unavailable: {}", e.getMessage());
            record.status(RefreshStatus.FAILURE).error(describe(e));
        } catch (ScheduleParseException e) {
            log.error("Refresh cycle failed, upstream schedule format not recognised (needs attention): {}",
                    e.getMessage());
            record.status(RefreshStatus.FAILURE).error(describe(e));
        } catch (ScheduleValidationException e) {
            log.error("Refresh cycle failed, fetched schedule is inconsistent: {}", e.getViolations());
            record.status(RefreshStatus.FAILURE).error(describe(e));
        } catch (RuntimeException e) {
            log.error("Refresh cycle failed unexpectedly", e);
            record.status(RefreshStatus.FAILURE).error(ErrorCode.INTERNAL_ERROR.getCode() + ": " + e.getMessage());
        }

        RefreshRecord saved = appendRecord(record.build());
        applicationEventPublisher.publishEvent(new CalendarRefreshedEvent(this, saved));
        return saved;
    }

    private RefreshRecord appendRecord(RefreshRecord record) {
        RefreshRecord bounded = record.getError() != null && record.getError().length() > MAX_ERROR_LENGTH
                ? record.toBuilder().error(record.getError().substring(0, MAX_ERROR_LENGTH)).build()
                : record;
        try {
            return calendarStore.appendRefreshRecord(bounded);
        } catch (RuntimeException e) {
            log.error("Failed to append refresh record {}", bounded, e);
            return bounded;
        }
    }

    private static String describe(BaseException e) {
        return e.getErrorCode().getCode() + ": " + e.getMessage();
    }
}
