package com.markethours.calendar;

import com.markethours.domain.enums.ClosureKind;
import com.markethours.domain.enums.SnapshotOrigin;
import com.markethours.domain.model.EarlyCloseOverride;
import com.markethours.domain.model.Holiday;
import com.markethours.domain.model.YearRange;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable, fully formed view of the committed calendar.
 *
 * <p>Readers grab the currently published snapshot from
 * {@link com.markethours.store.CalendarStore} and keep using that reference for the whole
 * query, so a concurrent commit can never be observed half-applied. A refresh builds a new
 * snapshot via {@link #replacingRange} and the store swaps it in with a single reference write.
 */
public final class CalendarSnapshot {

    private static final CalendarSnapshot EMPTY =
            new CalendarSnapshot(new TreeMap<>(), new TreeMap<>(), null, SnapshotOrigin.EMPTY);

    private final NavigableMap<LocalDate, Holiday> holidays;
    private final NavigableMap<LocalDate, LocalTime> earlyCloses;
    private final Instant refreshedAt;
    private final SnapshotOrigin origin;

    private CalendarSnapshot(
            NavigableMap<LocalDate, Holiday> holidays,
            NavigableMap<LocalDate, LocalTime> earlyCloses,
            Instant refreshedAt,
            SnapshotOrigin origin) {
        this.holidays = Collections.unmodifiableNavigableMap(holidays);
        this.earlyCloses = Collections.unmodifiableNavigableMap(earlyCloses);
        this.refreshedAt = refreshedAt;
        this.origin = origin;
    }

    /** Calendar with no holidays at all: only the weekday rule applies. */
    public static CalendarSnapshot empty() {
        return EMPTY;
    }

    public static CalendarSnapshot of(
            Collection<Holiday> holidays,
            Collection<EarlyCloseOverride> overrides,
            Instant refreshedAt,
            SnapshotOrigin origin) {
        NavigableMap<LocalDate, Holiday> holidayMap = new TreeMap<>();
        for (Holiday holiday : holidays) {
            if (holidayMap.putIfAbsent(holiday.getDate(), holiday) != null) {
                throw new IllegalArgumentException("Duplicate holiday for " + holiday.getDate());
            }
        }
        NavigableMap<LocalDate, LocalTime> earlyCloseMap = new TreeMap<>();
        for (EarlyCloseOverride override : overrides) {
            earlyCloseMap.put(override.getDate(), override.getCloseTime());
        }
        return new CalendarSnapshot(holidayMap, earlyCloseMap, refreshedAt, origin);
    }

    /**
     * Returns a new snapshot where everything inside {@code range} is replaced wholesale by the
     * given rows and everything outside it is carried over untouched.
     */
    public CalendarSnapshot replacingRange(
            YearRange range,
            Collection<Holiday> newHolidays,
            Collection<EarlyCloseOverride> newOverrides,
            Instant committedAt) {
        List<Holiday> mergedHolidays = new ArrayList<>(newHolidays);
        for (Holiday holiday : holidays.values()) {
            if (!range.contains(holiday.getDate())) {
                mergedHolidays.add(holiday);
            }
        }
        List<EarlyCloseOverride> mergedOverrides = new ArrayList<>(newOverrides);
        earlyCloses.forEach((date, closeTime) -> {
            if (!range.contains(date)) {
                mergedOverrides.add(EarlyCloseOverride.builder().date(date).closeTime(closeTime).build());
            }
        });
        return of(mergedHolidays, mergedOverrides, committedAt, SnapshotOrigin.REFRESH);
    }

    public Optional<Holiday> holidayOn(LocalDate date) {
        return Optional.ofNullable(holidays.get(date));
    }

    /** Full-closure holiday on the date, if any. */
    public Optional<Holiday> fullClosureOn(LocalDate date) {
        return holidayOn(date).filter(Holiday::isFullClosure);
    }

    public Optional<LocalTime> earlyCloseOn(LocalDate date) {
        return Optional.ofNullable(earlyCloses.get(date));
    }

    /** Display name for an early close: the paired EARLY_CLOSE holiday, or a generic label. */
    public String earlyCloseName(LocalDate date) {
        return holidayOn(date)
                .filter(h -> h.getClosureKind() == ClosureKind.EARLY_CLOSE)
                .map(Holiday::getName)
                .orElse("Early close");
    }

    /** Holidays between the two dates, both inclusive, in date order. */
    public List<Holiday> holidaysBetween(LocalDate start, LocalDate end) {
        return List.copyOf(holidays.subMap(start, true, end, true).values());
    }

    public List<Holiday> getHolidays() {
        return List.copyOf(holidays.values());
    }

    public List<EarlyCloseOverride> getEarlyCloseOverrides() {
        List<EarlyCloseOverride> overrides = new ArrayList<>();
        earlyCloses.forEach((date, time) -> overrides.add(
                EarlyCloseOverride.builder().date(date).closeTime(time).build()));
        return overrides;
    }

    public int holidayCount() {
        return holidays.size();
    }

    public Instant getRefreshedAt() {
        return refreshedAt;
    }

    public SnapshotOrigin getOrigin() {
        return origin;
    }

    @Override
    public String toString() {
        return "CalendarSnapshot{origin=" + origin + ", holidays=" + holidays.size() + ", earlyCloses="
                + earlyCloses.size() + ", refreshedAt=" + refreshedAt + "}";
    }
}
