package com.markethours.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Regular NYSE/NASDAQ session rule: Monday to Friday, 09:30-16:00 in US Eastern time
 * (DST-aware via the {@code America/New_York} zone).
 *
 * <pre>
 * 00:00-09:30  CLOSED_BEFORE_HOURS
 * 09:30-16:00  OPEN (or until the early-close time on half days)
 * 16:00-24:00  CLOSED_AFTER_HOURS
 * </pre>
 */
public final class ExchangeHours {

    public static final ZoneId ZONE = ZoneId.of("America/New_York");
    public static final LocalTime REGULAR_OPEN = LocalTime.of(9, 30);
    public static final LocalTime REGULAR_CLOSE = LocalTime.of(16, 0);

    private ExchangeHours() {}

    public static boolean isWeekend(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
    }

    /** True if the time lies strictly between the regular open and the regular close. */
    public static boolean isStrictlyWithinRegularSession(LocalTime time) {
        return time.isAfter(REGULAR_OPEN) && time.isBefore(REGULAR_CLOSE);
    }
}
