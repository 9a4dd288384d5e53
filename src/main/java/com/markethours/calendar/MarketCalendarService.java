package com.markethours.calendar;

import com.markethours.domain.enums.BoundaryDirection;
import com.markethours.domain.model.DaySchedule;
import com.markethours.domain.model.Holiday;
import com.markethours.domain.model.MarketEvent;
import com.markethours.domain.model.SessionState;
import com.markethours.exception.InvalidInputException;
import com.markethours.store.CalendarStore;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Read side of the market calendar. Every call reads the currently published
 * {@link CalendarSnapshot} once, so a single answer never mixes two calendar versions,
 * and never blocks on a refresh in progress.
 */
@Service
public class MarketCalendarService {

    private final CalendarStore calendarStore;
    private final SessionClassifier sessionClassifier;
    private final Clock clock;

    public MarketCalendarService(CalendarStore calendarStore, SessionClassifier sessionClassifier, Clock clock) {
        this.calendarStore = calendarStore;
        this.sessionClassifier = sessionClassifier;
        this.clock = clock;
    }

    public SessionState classify(Instant instant) {
        return sessionClassifier.classify(instant, calendarStore.snapshot());
    }

    public SessionState classify(TemporalAccessor temporal) {
        return sessionClassifier.classify(temporal, calendarStore.snapshot());
    }

    public SessionState classifyNow() {
        return classify(clock.instant());
    }

    public Instant nextSessionBoundary(Instant instant, BoundaryDirection direction) {
        return sessionClassifier.nextSessionBoundary(instant, direction, calendarStore.snapshot());
    }

    /** Holidays and early closes between {@code start} and {@code end}, both inclusive. */
    public List<Holiday> getCalendarRange(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new InvalidInputException("Both start and end dates are required");
        }
        if (start.isAfter(end)) {
            throw new InvalidInputException("Start date " + start + " is after end date " + end);
        }
        return calendarStore.snapshot().holidaysBetween(start, end);
    }

    public DaySchedule getSchedule(LocalDate date) {
        if (date == null) {
            throw new InvalidInputException("Date is required");
        }
        return sessionClassifier.scheduleFor(date, calendarStore.snapshot());
    }

    public DaySchedule getToday() {
        return getSchedule(today());
    }

    /** Seven days from {@code start}, or from today's exchange-local date when null. */
    public List<DaySchedule> getWeekSchedule(LocalDate start) {
        return sessionClassifier.weekSchedule(start != null ? start : today(), calendarStore.snapshot());
    }

    public MarketEvent getNextEvent() {
        return getNextEvent(clock.instant());
    }

    public MarketEvent getNextEvent(Instant instant) {
        if (instant == null) {
            throw new InvalidInputException("Instant is required");
        }
        return sessionClassifier.nextEvent(instant, calendarStore.snapshot());
    }

    public CalendarSnapshot currentSnapshot() {
        return calendarStore.snapshot();
    }

    /**
     * Resolves a caller-supplied timestamp. With {@code zoneId} the timestamp is read as a
     * local date-time in that zone; without it the timestamp must carry its own offset or zone
     * (ISO-8601, e.g. {@code 2024-07-03T13:30:00-04:00}). A null timestamp means now.
     */
    public Instant resolveInstant(String timestamp, String zoneId) {
        if (timestamp == null || timestamp.isBlank()) {
            return clock.instant();
        }
        try {
            if (zoneId != null && !zoneId.isBlank()) {
                return LocalDateTime.parse(timestamp.trim()).atZone(ZoneId.of(zoneId.trim())).toInstant();
            }
            return ZonedDateTime.parse(timestamp.trim(), DateTimeFormatter.ISO_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidInputException(
                    "Cannot parse '" + timestamp + "' as an ISO-8601 timestamp with offset or zone", e);
        } catch (DateTimeException e) {
            throw new InvalidInputException("Unknown time zone '" + zoneId + "'", e);
        }
    }

    private LocalDate today() {
        return clock.instant().atZone(ExchangeHours.ZONE).toLocalDate();
    }
}
