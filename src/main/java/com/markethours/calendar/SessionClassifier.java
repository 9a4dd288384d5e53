package com.markethours.calendar;

import com.markethours.domain.enums.BoundaryDirection;
import com.markethours.domain.enums.MarketEventType;
import com.markethours.domain.model.DaySchedule;
import com.markethours.domain.model.Holiday;
import com.markethours.domain.model.MarketEvent;
import com.markethours.domain.model.SessionState;
import com.markethours.exception.InvalidInputException;
import com.markethours.exception.NoUpcomingSessionException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Decides the trading-session state of an instant against a {@link CalendarSnapshot}.
 *
 * <p>Stateless and free of I/O: every answer is a function of the instant and the snapshot
 * passed in. Rules, first match wins:
 * <ol>
 *   <li>full-closure holiday on the exchange-local date - CLOSED_HOLIDAY</li>
 *   <li>Saturday or Sunday - CLOSED_WEEKEND</li>
 *   <li>before 09:30 - CLOSED_BEFORE_HOURS</li>
 *   <li>at or after the effective close - CLOSED_EARLY on half days, else CLOSED_AFTER_HOURS</li>
 *   <li>otherwise OPEN</li>
 * </ol>
 * The effective close is the early-close override for the date when one exists, else 16:00.
 */
@Component
public class SessionClassifier {

    /** Days scanned by the boundary search before giving up. */
    public static final int LOOKAHEAD_DAYS = 14;

    public SessionState classify(Instant instant, CalendarSnapshot snapshot) {
        if (instant == null) {
            throw new InvalidInputException("Instant is required");
        }
        ZonedDateTime local = instant.atZone(ExchangeHours.ZONE);
        LocalDate date = local.toLocalDate();
        LocalTime time = local.toLocalTime();

        Optional<Holiday> closure = snapshot.fullClosureOn(date);
        if (closure.isPresent()) {
            return SessionState.holiday(closure.get().getName());
        }
        if (ExchangeHours.isWeekend(date)) {
            return SessionState.weekend();
        }

        Optional<LocalTime> earlyClose = snapshot.earlyCloseOn(date);
        LocalTime effectiveClose = earlyClose.orElse(ExchangeHours.REGULAR_CLOSE);

        if (time.isBefore(ExchangeHours.REGULAR_OPEN)) {
            return SessionState.beforeHours();
        }
        if (!time.isBefore(effectiveClose)) {
            return earlyClose.isPresent()
                    ? SessionState.earlyClose(snapshot.earlyCloseName(date), effectiveClose)
                    : SessionState.afterHours();
        }
        return SessionState.open();
    }

    /**
     * Classifies any temporal that pins down an absolute instant (ZonedDateTime,
     * OffsetDateTime, Instant). A LocalDateTime has no zone and is rejected.
     */
    public SessionState classify(TemporalAccessor temporal, CalendarSnapshot snapshot) {
        return classify(toInstant(temporal), snapshot);
    }

    /**
     * Next open or close strictly after {@code instant}. Scans forward one exchange-local day
     * at a time, for at most {@link #LOOKAHEAD_DAYS} days.
     *
     * @throws NoUpcomingSessionException if no trading day falls inside the lookahead
     */
    public Instant nextSessionBoundary(Instant instant, BoundaryDirection direction, CalendarSnapshot snapshot) {
        if (instant == null || direction == null) {
            throw new InvalidInputException("Instant and direction are required");
        }
        LocalDate start = instant.atZone(ExchangeHours.ZONE).toLocalDate();
        for (int offset = 0; offset <= LOOKAHEAD_DAYS; offset++) {
            LocalDate date = start.plusDays(offset);
            if (!isTradingDay(date, snapshot)) {
                continue;
            }
            Instant boundary = direction == BoundaryDirection.NEXT_OPEN ? openAt(date) : closeAt(date, snapshot);
            if (boundary.isAfter(instant)) {
                return boundary;
            }
        }
        throw new NoUpcomingSessionException(String.format(
                "No %s within %d days of %s; calendar data may be missing",
                direction, LOOKAHEAD_DAYS, instant));
    }

    /** Returns true if the market opens at all on the exchange-local date. */
    public boolean isTradingDay(LocalDate date, CalendarSnapshot snapshot) {
        return !ExchangeHours.isWeekend(date) && snapshot.fullClosureOn(date).isEmpty();
    }

    public DaySchedule scheduleFor(LocalDate date, CalendarSnapshot snapshot) {
        Optional<Holiday> closure = snapshot.fullClosureOn(date);
        if (closure.isPresent()) {
            String name = closure.get().getName();
            return DaySchedule.builder()
                    .date(date)
                    .tradingDay(false)
                    .holidayName(name)
                    .notes("Market closed for " + name)
                    .build();
        }
        if (ExchangeHours.isWeekend(date)) {
            return DaySchedule.builder().date(date).tradingDay(false).notes("Weekend").build();
        }

        Optional<LocalTime> earlyClose = snapshot.earlyCloseOn(date);
        DaySchedule.DayScheduleBuilder builder = DaySchedule.builder()
                .date(date)
                .tradingDay(true)
                .openAt(openAt(date))
                .closeAt(closeAt(date, snapshot))
                .earlyClose(earlyClose.isPresent());
        if (earlyClose.isPresent()) {
            String name = snapshot.earlyCloseName(date);
            builder.holidayName(name).notes("Early close at " + earlyClose.get() + " ET (" + name + ")");
        } else {
            builder.notes("Regular trading hours");
        }
        return builder.build();
    }

    /** Seven consecutive day schedules starting at {@code start}. */
    public List<DaySchedule> weekSchedule(LocalDate start, CalendarSnapshot snapshot) {
        List<DaySchedule> week = new ArrayList<>(7);
        for (int i = 0; i < 7; i++) {
            week.add(scheduleFor(start.plusDays(i), snapshot));
        }
        return week;
    }

    /** Whichever of the next open and the next close comes first. */
    public MarketEvent nextEvent(Instant now, CalendarSnapshot snapshot) {
        Instant nextOpen = nextSessionBoundary(now, BoundaryDirection.NEXT_OPEN, snapshot);
        Instant nextClose = nextSessionBoundary(now, BoundaryDirection.NEXT_CLOSE, snapshot);

        boolean closeFirst = nextClose.isBefore(nextOpen);
        Instant at = closeFirst ? nextClose : nextOpen;
        LocalDate sessionDate = at.atZone(ExchangeHours.ZONE).toLocalDate();
        DaySchedule day = scheduleFor(sessionDate, snapshot);

        return MarketEvent.builder()
                .type(closeFirst ? MarketEventType.CLOSE : MarketEventType.OPEN)
                .at(at)
                .secondsUntil(Duration.between(now, at).getSeconds())
                .sessionDate(sessionDate)
                .earlyClose(day.isEarlyClose())
                .notes(day.getNotes())
                .build();
    }

    private Instant openAt(LocalDate date) {
        return ZonedDateTime.of(date, ExchangeHours.REGULAR_OPEN, ExchangeHours.ZONE).toInstant();
    }

    private Instant closeAt(LocalDate date, CalendarSnapshot snapshot) {
        LocalTime close = snapshot.earlyCloseOn(date).orElse(ExchangeHours.REGULAR_CLOSE);
        return ZonedDateTime.of(date, close, ExchangeHours.ZONE).toInstant();
    }

    static Instant toInstant(TemporalAccessor temporal) {
        if (temporal == null) {
            throw new InvalidInputException("Timestamp is required");
        }
        try {
            return Instant.from(temporal);
        } catch (DateTimeException e) {
            throw new InvalidInputException("Cannot resolve an absolute instant from " + temporal
                    + "; include an offset or time zone", e);
        }
    }
}
